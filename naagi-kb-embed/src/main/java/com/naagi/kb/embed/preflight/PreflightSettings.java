package com.naagi.kb.embed.preflight;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Embedding configuration a run is checked against.
 *
 * @param minQuality      documents scoring below this go on the skip list
 * @param smallChunkTokens chunks below this size count towards the advisory below-threshold percentage
 */
public record PreflightSettings(
        String provider,
        String model,
        int dimension,
        int minEmbedDocs,
        double minQuality,
        String tokenizer,
        int smallChunkTokens
) {
    public static final int MAX_DIMENSION = 8192;
    public static final double DEFAULT_MIN_QUALITY = 0.60;

    private static final Set<String> PROVIDERS = Set.of("openai", "ollama", "dummy");

    /**
     * Configuration problems, empty when the settings are usable.
     */
    public List<String> problems() {
        List<String> out = new ArrayList<>();
        if (provider == null || !PROVIDERS.contains(provider)) {
            out.add("unknown provider: " + provider);
        }
        if (model == null || model.isBlank()) {
            out.add("model is required");
        } else if ("openai".equals(provider) && !model.startsWith("text-embedding")) {
            out.add("openai model must be a text-embedding model: " + model);
        }
        if (dimension < 1 || dimension > MAX_DIMENSION) {
            out.add("dimension must be in [1, " + MAX_DIMENSION + "]: " + dimension);
        }
        if (minEmbedDocs < 1) {
            out.add("minEmbedDocs must be >= 1");
        }
        if (minQuality < 0 || minQuality > 1) {
            out.add("minQuality must be in [0, 1]");
        }
        return out;
    }
}
