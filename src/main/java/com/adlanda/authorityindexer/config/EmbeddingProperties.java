package com.adlanda.authorityindexer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for batching and embedding.
 *
 * Maps to properties prefixed with 'indexer.embedding' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "indexer.embedding")
public class EmbeddingProperties {

    /**
     * Embedding model identifier sent with every request.
     */
    private String model = "text-embedding-3-small";

    /**
     * Expected vector length. Every returned vector is checked against it.
     */
    private int dimension = 1536;

    /**
     * Maximum chunks per provider request.
     */
    private int batchSize = 40;

    /**
     * Maximum tokens per provider request (conservative, the API allows 8192 per input).
     */
    private int maxTokensPerBatch = 3500;

    /**
     * Chunks above this token count are truncated before batching.
     */
    private int maxTokensPerChunk = 3000;

    /**
     * Wait before the single retry of a rate-limited request.
     */
    private Duration rateLimitRetryDelay = Duration.ofSeconds(5);

    /**
     * Pause between consecutive batches.
     */
    private Duration interBatchDelay = Duration.ofMillis(100);

    /**
     * USD per million tokens, used for cost estimates ($0.02 for text-embedding-3-small).
     */
    private double pricePerMillionTokens = 0.02;

    /**
     * Token counting mode: 'precise' (JTokkit) or 'heuristic' (characters / 3).
     */
    private String tokenizer = "precise";

    /**
     * JTokkit encoding used when the model name is not known to the registry.
     */
    private String tokenizerEncoding = "cl100k_base";

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getDimension() {
        return dimension;
    }

    public void setDimension(int dimension) {
        this.dimension = dimension;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxTokensPerBatch() {
        return maxTokensPerBatch;
    }

    public void setMaxTokensPerBatch(int maxTokensPerBatch) {
        this.maxTokensPerBatch = maxTokensPerBatch;
    }

    public int getMaxTokensPerChunk() {
        return maxTokensPerChunk;
    }

    public void setMaxTokensPerChunk(int maxTokensPerChunk) {
        this.maxTokensPerChunk = maxTokensPerChunk;
    }

    public Duration getRateLimitRetryDelay() {
        return rateLimitRetryDelay;
    }

    public void setRateLimitRetryDelay(Duration rateLimitRetryDelay) {
        this.rateLimitRetryDelay = rateLimitRetryDelay;
    }

    public Duration getInterBatchDelay() {
        return interBatchDelay;
    }

    public void setInterBatchDelay(Duration interBatchDelay) {
        this.interBatchDelay = interBatchDelay;
    }

    public double getPricePerMillionTokens() {
        return pricePerMillionTokens;
    }

    public void setPricePerMillionTokens(double pricePerMillionTokens) {
        this.pricePerMillionTokens = pricePerMillionTokens;
    }

    public String getTokenizer() {
        return tokenizer;
    }

    public void setTokenizer(String tokenizer) {
        this.tokenizer = tokenizer;
    }

    public String getTokenizerEncoding() {
        return tokenizerEncoding;
    }

    public void setTokenizerEncoding(String tokenizerEncoding) {
        this.tokenizerEncoding = tokenizerEncoding;
    }
}
