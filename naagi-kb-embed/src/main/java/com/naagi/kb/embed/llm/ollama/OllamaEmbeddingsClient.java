package com.naagi.kb.embed.llm.ollama;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.naagi.kb.core.json.Json;
import com.naagi.kb.embed.llm.EmbeddingsClient;
import com.naagi.kb.embed.llm.Http;
import com.naagi.kb.embed.llm.ProviderException;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Ollama embeddings via REST.
 * Endpoint: POST /api/embed
 * Body: { "model": "...", "input": ["text", ...] }
 * Response: { "embeddings": [[...], ...] }
 */
public final class OllamaEmbeddingsClient implements EmbeddingsClient {

    public static final String PROVIDER = "ollama";

    private final URI endpoint;
    private final String model;
    private final Integer dimension;

    public OllamaEmbeddingsClient(String baseUrl, String model, Integer dimension) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.endpoint = URI.create(base + "/api/embed");
        this.model = model;
        this.dimension = dimension;
    }

    @Override
    public List<Double> embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<List<Double>> embedBatch(List<String> texts) {
        ObjectNode body = Json.MAPPER.createObjectNode().put("model", model);
        ArrayNode input = body.putArray("input");
        texts.forEach(input::add);

        String json = Http.postJson(Http.CLIENT, PROVIDER, endpoint, body, Map.of());
        JsonNode arr;
        try {
            arr = Json.MAPPER.readTree(json).get("embeddings");
        } catch (JsonProcessingException e) {
            throw new ProviderException("Bad Ollama embed JSON", false, 200, e);
        }
        if (arr == null || !arr.isArray() || arr.size() != texts.size()) {
            throw new ProviderException("Bad Ollama embed JSON: expected " + texts.size() + " embeddings", false, 200);
        }
        List<List<Double>> out = new ArrayList<>(arr.size());
        for (JsonNode vec : arr) {
            List<Double> v = new ArrayList<>(vec.size());
            for (JsonNode n : vec) v.add(n.asDouble());
            out.add(v);
        }
        return out;
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
        return dimension;
    }
}
