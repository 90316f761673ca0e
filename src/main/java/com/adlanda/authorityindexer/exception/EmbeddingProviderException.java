package com.adlanda.authorityindexer.exception;

/**
 * The embedding provider failed for a reason other than throttling.
 */
public class EmbeddingProviderException extends RuntimeException {

    public EmbeddingProviderException(String message) {
        super(message);
    }

    public EmbeddingProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
