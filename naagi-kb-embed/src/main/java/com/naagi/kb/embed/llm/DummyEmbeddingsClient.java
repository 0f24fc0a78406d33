package com.naagi.kb.embed.llm;

import com.naagi.kb.core.util.Hashing;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic offline provider: unit vectors seeded from the SHA-256 of the text.
 * Identical text always yields the identical vector.
 */
public final class DummyEmbeddingsClient implements EmbeddingsClient {

    public static final String PROVIDER = "dummy";

    private final String model;
    private final int dimension;

    public DummyEmbeddingsClient(int dimension) {
        this("dummy-sha256", dimension);
    }

    public DummyEmbeddingsClient(String model, int dimension) {
        if (dimension <= 0) throw new IllegalArgumentException("dimension must be positive");
        this.model = model;
        this.dimension = dimension;
    }

    @Override
    public List<Double> embed(String text) {
        Random rnd = new Random(ByteBuffer.wrap(Hashing.sha256(text)).getLong());
        double[] v = new double[dimension];
        double norm = 0;
        for (int i = 0; i < dimension; i++) {
            v[i] = rnd.nextGaussian();
            norm += v[i] * v[i];
        }
        norm = Math.sqrt(norm);
        List<Double> out = new ArrayList<>(dimension);
        for (double d : v) out.add(norm == 0 ? 0.0 : d / norm);
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
