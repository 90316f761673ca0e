package com.adlanda.authorityindexer.exception;

/**
 * An embedding vector does not have the configured dimension.
 *
 * Downstream storage is sized for a single dimension, so this is never recoverable.
 */
public class DimensionMismatchException extends RuntimeException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Unexpected embedding dimension: " + actual + " (expected " + expected + ")");
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
