package com.naagi.kb.embed.guard;

import com.naagi.kb.embed.llm.EmbeddingsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Compares a provider's output dimension with the store's fixed dimension.
 */
public final class DimensionGuard {

    private static final Logger log = LoggerFactory.getLogger(DimensionGuard.class);

    static final String TRIAL_TEXT = "dimension check";

    private final EmbeddingsClient client;
    private final int expected;

    public DimensionGuard(EmbeddingsClient client, int expected) {
        this.client = client;
        this.expected = expected;
    }

    /**
     * Resolves the provider dimension (declared, or from one trial call) and fails on mismatch.
     *
     * @return the verified dimension
     */
    public int verify() {
        Integer declared = client.declaredDimension();
        int actual;
        if (declared != null) {
            actual = declared;
        } else {
            actual = client.embed(TRIAL_TEXT).size();
            log.info("Measured {} / {} dimension: {}", client.provider(), client.model(), actual);
        }
        check(actual);
        return actual;
    }

    public void check(List<Double> vector) {
        check(vector.size());
    }

    private void check(int actual) {
        if (actual != expected) {
            throw new DimensionMismatchException(client.provider(), client.model(), expected, actual);
        }
    }

    public int expected() {
        return expected;
    }
}
