package com.codefarm.shortlink.service.web;

import com.codefarm.shortlink.service.exception.StorageUnavailableException;
import com.codefarm.shortlink.service.repository.LinkStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ShortLinkServerErrorTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LinkStore store;

    @Test
    void everyCandidateTakenIsGenerationExhausted() throws Exception {
        when(store.putIfAbsent(anyString(), anyString())).thenReturn(false);

        mockMvc.perform(post("/shorten")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"https://example.com\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("GENERATION_EXHAUSTED"));

        verify(store, times(5)).putIfAbsent(anyString(), anyString());
    }

    @Test
    void failingInsertIsStorageUnavailable() throws Exception {
        when(store.putIfAbsent(anyString(), anyString()))
                .thenThrow(new StorageUnavailableException("Database error: connection refused", null));

        mockMvc.perform(post("/shorten")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"https://example.com\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("STORAGE_UNAVAILABLE"));

        verify(store, times(1)).putIfAbsent(anyString(), anyString());
    }

    @Test
    void failingLookupIsStorageUnavailable() throws Exception {
        when(store.get("abc123"))
                .thenThrow(new StorageUnavailableException("Database error: connection refused", null));

        mockMvc.perform(get("/abc123"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("STORAGE_UNAVAILABLE"))
                .andExpect(header().doesNotExist("Location"));
    }
}
