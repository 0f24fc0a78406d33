package com.naagi.kb.embed.llm.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.naagi.kb.core.json.Json;
import com.naagi.kb.embed.llm.EmbeddingsClient;
import com.naagi.kb.embed.llm.Http;
import com.naagi.kb.embed.llm.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible embeddings via {@code POST /v1/embeddings} with batched input.
 */
public final class OpenAIEmbeddingsClient implements EmbeddingsClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAIEmbeddingsClient.class);

    public static final String PROVIDER = "openai";

    private static final Map<String, Integer> KNOWN_DIMENSIONS = Map.of(
            "text-embedding-3-small", 1536,
            "text-embedding-3-large", 3072,
            "text-embedding-ada-002", 1536);

    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final Integer dimensions;
    private final HttpClient http;

    public OpenAIEmbeddingsClient(String baseUrl, String model, String apiKey, Integer dimensions) {
        this(baseUrl, model, apiKey, dimensions, Http.CLIENT);
    }

    OpenAIEmbeddingsClient(String baseUrl, String model, String apiKey, Integer dimensions, HttpClient http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.apiKey = apiKey;
        this.dimensions = dimensions;
        this.http = http;
    }

    @Override
    public List<Double> embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<List<Double>> embedBatch(List<String> texts) {
        long startTime = System.currentTimeMillis();
        ObjectNode body = Json.MAPPER.createObjectNode().put("model", model);
        ArrayNode input = body.putArray("input");
        texts.forEach(input::add);
        if (dimensions != null) body.put("dimensions", dimensions);

        Map<String, String> headers = apiKey == null || apiKey.isBlank()
                ? Map.of()
                : Map.of("Authorization", "Bearer " + apiKey);
        String json = Http.postJson(http, PROVIDER, URI.create(baseUrl + "/v1/embeddings"), body, headers);

        List<List<Double>> out = parse(json, texts.size());
        log.debug("[EMBED TIMING] total={}ms batch={} model={}", System.currentTimeMillis() - startTime, texts.size(), model);
        return out;
    }

    private static List<List<Double>> parse(String json, int expected) {
        JsonNode root;
        try {
            root = Json.MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Bad OpenAI embed response: not JSON", false, 200, e);
        }
        JsonNode data = root.get("data");
        if (data == null || !data.isArray() || data.size() != expected) {
            throw new ProviderException("Bad OpenAI embed response: expected " + expected + " items in data array", false, 200);
        }

        List<List<Double>> ordered = new ArrayList<>(Collections.nCopies(expected, null));
        int pos = 0;
        for (JsonNode item : data) {
            int index = item.has("index") ? item.get("index").asInt() : pos;
            JsonNode vec = item.get("embedding");
            if (vec == null || !vec.isArray() || index < 0 || index >= expected) {
                throw new ProviderException("Bad OpenAI embed response: missing embedding array", false, 200);
            }
            List<Double> v = new ArrayList<>(vec.size());
            for (JsonNode n : vec) v.add(n.asDouble());
            ordered.set(index, v);
            pos++;
        }
        if (ordered.contains(null)) {
            throw new ProviderException("Bad OpenAI embed response: duplicate item index", false, 200);
        }
        return ordered;
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public Integer declaredDimension() {
        return dimensions != null ? dimensions : KNOWN_DIMENSIONS.get(model);
    }
}
