package com.adlanda.authorityindexer.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.time.Instant;
import java.util.UUID;

/**
 * Maps pipeline failures to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
                                                     HttpServletRequest request) {
        String errorId = generateErrorId();
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .orElse("Validation failed");

        log.warn("Validation error [{}]: {}", errorId, message);
        return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
    }

    // Raised instead of MethodArgumentNotValidException for lists of documents
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiError> handleMethodValidation(HandlerMethodValidationException ex,
                                                           HttpServletRequest request) {
        String errorId = generateErrorId();
        String message = ex.getAllErrors().stream()
                .findFirst()
                .map(error -> error.getDefaultMessage())
                .orElse("Validation failed");

        log.warn("Validation error [{}]: {}", errorId, message);
        return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex,
                                                     HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("Malformed request [{}]: {}", errorId, ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.MALFORMED_REQUEST,
                "Request body could not be parsed", request);
    }

    @ExceptionHandler(EmbeddingRunException.class)
    public ResponseEntity<ApiError> handleEmbeddingRun(EmbeddingRunException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Embedding run failed [{}]: {}", errorId, ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.EMBEDDING_FAILED, ex.getMessage(), request);
    }

    @ExceptionHandler(IngestionInProgressException.class)
    public ResponseEntity<ApiError> handleInProgress(IngestionInProgressException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("Ingestion rejected [{}]: {}", errorId, ex.getMessage());
        return respond(HttpStatus.CONFLICT, errorId, ApiError.INGESTION_IN_PROGRESS, ex.getMessage(), request);
    }

    @ExceptionHandler(DocumentLoadException.class)
    public ResponseEntity<ApiError> handleDocumentLoad(DocumentLoadException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Document load error [{}]: {}", errorId, ex.getMessage(), ex);
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, errorId, ApiError.DOCUMENT_LOAD_FAILED,
                "Documents could not be loaded from " + ex.getPath(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.INTERNAL_ERROR,
                "An unexpected error occurred. Please try again later.", request);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String errorId, String code,
                                             String message, HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(new ApiError(errorId, code, message, request.getRequestURI(), Instant.now()));
    }

    private String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
