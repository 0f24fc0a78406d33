package com.naagi.kb.embed.llm;

import java.util.ArrayList;
import java.util.List;

/**
 * External embedding provider.
 */
public interface EmbeddingsClient {

    List<Double> embed(String text);

    /**
     * Embeds several texts, preserving input order. Providers with a native batch endpoint override this.
     */
    default List<List<Double>> embedBatch(List<String> texts) {
        List<List<Double>> out = new ArrayList<>(texts.size());
        for (String t : texts) out.add(embed(t));
        return out;
    }

    String provider();

    String model();

    /**
     * Output dimension when known without calling the provider, otherwise null.
     */
    default Integer declaredDimension() {
        return null;
    }
}
