package com.codefarm.shortlink.service.web;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Goes through the embedded server, which is where header values get encoded.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class RedirectLocationHeaderTest {

    @LocalServerPort
    private int port;

    private final HttpClient client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();

    @Test
    void nonAsciiUrlRedirectsWithPercentEncodedLocation() throws Exception {
        String shortId = shorten("https://example.com/日本?q=ü");

        HttpResponse<String> redirect = client.send(
                HttpRequest.newBuilder(URI.create(baseUrl() + "/" + shortId)).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(redirect.statusCode()).isEqualTo(302);
        String location = redirect.headers().firstValue("Location").orElse(null);
        assertThat(location).isEqualTo("https://example.com/%E6%97%A5%E6%9C%AC?q=%C3%BC");
        assertThat(URI.create(location).getPath()).isEqualTo("/日本");
        assertThat(URI.create(location).getQuery()).isEqualTo("q=ü");
    }

    @Test
    void asciiUrlRedirectsUnchanged() throws Exception {
        String url = "https://example.com/a/b?c=d%20e&f=g#h";
        String shortId = shorten(url);

        HttpResponse<String> redirect = client.send(
                HttpRequest.newBuilder(URI.create(baseUrl() + "/" + shortId)).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(redirect.statusCode()).isEqualTo(302);
        assertThat(redirect.headers().firstValue("Location")).contains(url);
    }

    private String shorten(String url) throws Exception {
        HttpResponse<String> response = client.send(
                HttpRequest.newBuilder(URI.create(baseUrl() + "/shorten"))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString("{\"url\": \"" + url + "\"}"))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
        assertThat(response.statusCode()).isEqualTo(200);
        return JsonPath.read(response.body(), "$.short_id");
    }

    private String baseUrl() {
        return "http://localhost:" + port;
    }
}
