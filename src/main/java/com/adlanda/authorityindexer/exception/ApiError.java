package com.adlanda.authorityindexer.exception;

import java.time.Instant;

/**
 * Error body returned by every REST endpoint.
 *
 * @param errorId short id also written to the log, to correlate the two
 */
public record ApiError(
        String errorId,
        String code,
        String message,
        String path,
        Instant timestamp
) {
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String MALFORMED_REQUEST = "MALFORMED_REQUEST";
    public static final String EMBEDDING_FAILED = "EMBEDDING_FAILED";
    public static final String INGESTION_IN_PROGRESS = "INGESTION_IN_PROGRESS";
    public static final String DOCUMENT_LOAD_FAILED = "DOCUMENT_LOAD_FAILED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
