package com.naagi.kb.embed.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.naagi.kb.core.json.Json;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Shared HTTP plumbing of the embedding providers. Transport failures are retryable;
 * non-2xx answers are classified by {@link ProviderException#forStatus}.
 */
public final class Http {
    public static final HttpClient CLIENT = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .build();

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private Http() {}

    /**
     * POSTs {@code body} as JSON and returns the body of a 2xx response.
     */
    public static String postJson(HttpClient client, String provider, URI uri, JsonNode body,
                                  Map<String, String> headers) {
        HttpResponse<String> resp;
        try {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)));
            headers.forEach(req::header);
            resp = client.send(req.build(), HttpResponse.BodyHandlers.ofString());
        } catch (JsonProcessingException e) {
            throw new ProviderException("Could not encode " + provider + " request", false, ProviderException.NO_STATUS, e);
        } catch (IOException e) {
            throw new ProviderException(provider + " embedding request failed: " + e.getMessage(),
                    true, ProviderException.NO_STATUS, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while embedding", false, ProviderException.NO_STATUS, e);
        }
        if (resp.statusCode() / 100 != 2) {
            throw ProviderException.forStatus(provider, resp.statusCode(), resp.body());
        }
        return resp.body();
    }
}
