package com.codefarm.shortlink.service.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ShortenResponse(
        @JsonProperty("short_id") String shortId,
        @JsonProperty("short_url") String shortUrl) {
}
