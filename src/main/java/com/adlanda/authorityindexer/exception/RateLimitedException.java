package com.adlanda.authorityindexer.exception;

/**
 * The embedding provider rejected a request because of rate limiting.
 */
public class RateLimitedException extends EmbeddingProviderException {

    public RateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}
