package com.naagi.kb.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "naagi.kb")
public class KbProperties {

    private String runsRoot = "var/runs";
    private EventsConfig events = new EventsConfig();
    private ChunkingConfig chunking = new ChunkingConfig();
    private EmbedConfig embed = new EmbedConfig();
    private StoreConfig store = new StoreConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();

    @Data
    public static class EventsConfig {
        private boolean enabled = true;
    }

    @Data
    public static class ChunkingConfig {
        private String tokenizer = "cl100k";
        private int hardMaxTokens = 800;
        private int overlapTokens = 60;
        private int softMinTokens = 200;
        private int hardMinTokens = 80;
        private boolean preferHeadings = true;
        private boolean orphanHeadingMerge = true;
        private boolean smallTailMerge = true;
        private double minCoverage = 0.995;
    }

    @Data
    public static class EmbedConfig {
        private String provider = "dummy";
        private String model = "dummy-sha256";
        private int dimension = 1536;
        private int batchSize = 128;
        private int minEmbedDocs = 1;
        private double minQuality = 0.60;
        private int smallChunkTokens = 80;
        private int workers = 2;
        private RetryConfig retry = new RetryConfig();
        private OpenAiConfig openai = new OpenAiConfig();
        private OllamaConfig ollama = new OllamaConfig();
    }

    @Data
    public static class RetryConfig {
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);
        private double jitterRatio = 0.2;
    }

    @Data
    public static class OpenAiConfig {
        private String baseUrl = "https://api.openai.com";
        private String apiKey;
        private boolean sendDimensions = true;
    }

    @Data
    public static class OllamaConfig {
        private String baseUrl = "http://localhost:11434";
    }

    @Data
    public static class StoreConfig {
        private StoreType type = StoreType.MEMORY;
    }

    @Data
    public static class RetrievalConfig {
        private int topK = 8;
        private int rrfK = 60;
        private int topkDense = 200;
        private int topkBm25 = 200;
        private int maxChunksPerDoc = 3;
        private boolean hybridEnabled = true;
        private boolean boostsEnabled = true;
        private boolean domainFilterEnabled = false;
        private List<String> spaceWhitelist = new ArrayList<>();
        private int snippetChars = 300;
        private int workers = 4;
        // Empty keeps the built-in methodology/playbook/runbook/periodic rules
        private List<BoostConfig> boosts = new ArrayList<>();
        private DomainConfig domain = new DomainConfig();
    }

    @Data
    public static class BoostConfig {
        private String name;
        private String pattern;
        private double value;
    }

    /**
     * Overrides for the built-in N2S domain profile. Unset lists keep the built-in values.
     */
    @Data
    public static class DomainConfig {
        private String name;
        private List<String> triggers = new ArrayList<>();
        private List<String> expansions = new ArrayList<>();
        private List<TopicConfig> topics = new ArrayList<>();
        private List<String> documentTitleTerms = new ArrayList<>();
        private List<String> documentTypes = new ArrayList<>();
        private List<String> spaceWhitelist = new ArrayList<>();
    }

    @Data
    public static class TopicConfig {
        private String name;
        private List<String> keywords = new ArrayList<>();
        private List<String> phrases = new ArrayList<>();
    }

    public enum StoreType {
        MEMORY,
        PGVECTOR
    }
}
