package com.adlanda.authorityindexer.service.embedding;

import com.adlanda.authorityindexer.config.EmbeddingProperties;
import com.adlanda.authorityindexer.model.Batch;
import com.adlanda.authorityindexer.model.Chunk;
import com.adlanda.authorityindexer.model.TokenizedChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups chunks into provider requests bounded by chunk count and token budget.
 *
 * Chunks above the per-chunk token cap are truncated first. The truncated chunk
 * is a new value; the input chunk is left untouched.
 */
@Service
public class BatchBuilder {

    private static final Logger log = LoggerFactory.getLogger(BatchBuilder.class);

    private final TokenCounter tokenCounter;
    private final EmbeddingProperties properties;

    public BatchBuilder(TokenCounter tokenCounter, EmbeddingProperties properties) {
        this.tokenCounter = tokenCounter;
        this.properties = properties;
    }

    /**
     * Builds batches using the configured limits.
     */
    public List<Batch> build(List<Chunk> chunks) {
        return build(chunks, properties.getBatchSize(), properties.getMaxTokensPerBatch(),
                properties.getMaxTokensPerChunk());
    }

    /**
     * Builds batches in input order.
     *
     * A new batch starts when the current one already holds maxCount chunks or the next
     * chunk would push it over maxTokensPerBatch. A chunk that alone exceeds the batch
     * budget still gets a batch of its own.
     *
     * @param chunks             Chunks to batch
     * @param maxCount           Maximum chunks per batch
     * @param maxTokensPerBatch  Maximum tokens per batch
     * @param maxTokensPerChunk  Chunks above this are truncated
     * @return Batches in order, each with chunks in order
     */
    public List<Batch> build(List<Chunk> chunks, int maxCount, int maxTokensPerBatch, int maxTokensPerChunk) {
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be positive, was " + maxCount);
        }

        List<Batch> batches = new ArrayList<>();
        List<TokenizedChunk> current = new ArrayList<>();
        int currentTokens = 0;

        for (Chunk chunk : chunks) {
            TokenizedChunk tokenized = tokenize(chunk, maxTokensPerChunk);

            boolean full = current.size() >= maxCount
                    || currentTokens + tokenized.tokenCount() > maxTokensPerBatch;
            if (full && !current.isEmpty()) {
                batches.add(Batch.of(current));
                current = new ArrayList<>();
                currentTokens = 0;
            }

            current.add(tokenized);
            currentTokens += tokenized.tokenCount();
        }

        if (!current.isEmpty()) {
            batches.add(Batch.of(current));
        }

        log.debug("Built {} batches from {} chunks using {}", batches.size(), chunks.size(), tokenCounter.name());
        return batches;
    }

    /**
     * Counts tokens for a chunk, truncating it when it exceeds the per-chunk cap.
     */
    TokenizedChunk tokenize(Chunk chunk, int maxTokensPerChunk) {
        int tokens = tokenCounter.count(chunk.text());
        if (tokens <= maxTokensPerChunk) {
            return new TokenizedChunk(chunk, tokens);
        }

        int maxChars = HeuristicTokenCounter.charsForTokens(maxTokensPerChunk);
        Chunk truncated = chunk.truncate(maxChars);
        int truncatedTokens = tokenCounter.count(truncated.text());

        log.warn("Chunk {} exceeds token limit ({} > {}), truncated from {} to {} chars ({} tokens)",
                chunk.stringId(), tokens, maxTokensPerChunk, chunk.length(), truncated.length(), truncatedTokens);
        return new TokenizedChunk(truncated, truncatedTokens);
    }
}
