package com.naagi.kb.config;

import com.naagi.kb.embed.llm.DummyEmbeddingsClient;
import com.naagi.kb.embed.llm.EmbeddingsClient;
import com.naagi.kb.embed.llm.ollama.OllamaEmbeddingsClient;
import com.naagi.kb.embed.llm.openai.OpenAIEmbeddingsClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LlmProviderConfig {

    // Deterministic hash vectors, no network (default)
    @Bean
    @ConditionalOnProperty(name = "naagi.kb.embed.provider", havingValue = "dummy", matchIfMissing = true)
    public EmbeddingsClient embeddingsDummy(
            @Value("${naagi.kb.embed.model:dummy-sha256}") String model,
            @Value("${naagi.kb.embed.dimension:1536}") int dimension
    ) {
        return new DummyEmbeddingsClient(model, dimension);
    }

    // OpenAI or any OpenAI-compatible /v1/embeddings endpoint
    @Bean
    @ConditionalOnProperty(name = "naagi.kb.embed.provider", havingValue = "openai")
    public EmbeddingsClient embeddingsOpenAI(
            @Value("${naagi.kb.embed.openai.base-url:https://api.openai.com}") String baseUrl,
            @Value("${naagi.kb.embed.model}") String model,
            @Value("${naagi.kb.embed.openai.api-key:}") String apiKey,
            @Value("${naagi.kb.embed.openai.send-dimensions:true}") boolean sendDimensions,
            @Value("${naagi.kb.embed.dimension:1536}") int dimension
    ) {
        return new OpenAIEmbeddingsClient(baseUrl, model, apiKey, sendDimensions ? dimension : null);
    }

    // Ollama native /api/embed
    @Bean
    @ConditionalOnProperty(name = "naagi.kb.embed.provider", havingValue = "ollama")
    public EmbeddingsClient embeddingsOllama(
            @Value("${naagi.kb.embed.ollama.base-url:http://localhost:11434}") String baseUrl,
            @Value("${naagi.kb.embed.model}") String model,
            @Value("${naagi.kb.embed.dimension:1536}") int dimension
    ) {
        return new OllamaEmbeddingsClient(baseUrl, model, dimension);
    }
}
