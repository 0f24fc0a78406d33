package com.naagi.kb.embed.guard;

/**
 * The provider's vectors do not match the store's fixed dimension. Always fatal,
 * raised before any write.
 */
public class DimensionMismatchException extends RuntimeException {

    private final String provider;
    private final String model;
    private final int expected;
    private final int actual;

    public DimensionMismatchException(String provider, String model, int expected, int actual) {
        super(String.format("Dimension mismatch for provider '%s' model '%s': expected %d, got %d",
                provider, model, expected, actual));
        this.provider = provider;
        this.model = model;
        this.expected = expected;
        this.actual = actual;
    }

    public String getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
