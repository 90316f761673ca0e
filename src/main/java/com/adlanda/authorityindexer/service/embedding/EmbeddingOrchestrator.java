package com.adlanda.authorityindexer.service.embedding;

import com.adlanda.authorityindexer.config.EmbeddingProperties;
import com.adlanda.authorityindexer.exception.EmbeddingProviderException;
import com.adlanda.authorityindexer.exception.EmbeddingRunException;
import com.adlanda.authorityindexer.exception.RateLimitedException;
import com.adlanda.authorityindexer.model.Batch;
import com.adlanda.authorityindexer.model.EmbeddedChunk;
import com.adlanda.authorityindexer.model.EmbeddingProgress;
import com.adlanda.authorityindexer.model.EmbeddingRunResult;
import com.adlanda.authorityindexer.model.TokenizedChunk;
import com.adlanda.authorityindexer.service.ChunkIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Drives batches through the embedding provider, one request at a time.
 *
 * Failure policy:
 * - rate limited: wait the configured delay and retry the batch once; a second rate limit is fatal
 * - any other provider error: fatal, no retry
 * - a vector of the wrong dimension: fatal for the whole run
 *
 * Fatal failures throw {@link EmbeddingRunException} and no records are returned.
 * Cancellation is checked between batches; a cancelled run returns what was embedded so far.
 */
@Service
public class EmbeddingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingOrchestrator.class);

    private final EmbeddingProvider provider;
    private final ChunkIdGenerator idGenerator;
    private final EmbeddingProperties properties;
    private final Sleeper sleeper;

    private final AtomicReference<EmbeddingProgress> progress = new AtomicReference<>(EmbeddingProgress.idle());

    public EmbeddingOrchestrator(EmbeddingProvider provider,
                                 ChunkIdGenerator idGenerator,
                                 EmbeddingProperties properties,
                                 Sleeper sleeper) {
        this.provider = provider;
        this.idGenerator = idGenerator;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    /**
     * Embeds all batches with the configured inter-batch delay and no cancellation.
     */
    public EmbeddingRunResult run(List<Batch> batches) {
        return run(batches, properties.getInterBatchDelay(), () -> false);
    }

    /**
     * Embeds batches strictly in order.
     *
     * @param batches               Batches from {@link BatchBuilder}
     * @param interBatchDelay       Pause between batches (not after the last)
     * @param cancellationRequested Checked before each batch; true stops the run
     * @return Embedded chunks in input order, with run totals
     * @throws EmbeddingRunException on any fatal failure
     */
    public EmbeddingRunResult run(List<Batch> batches, Duration interBatchDelay,
                                  BooleanSupplier cancellationRequested) {
        EmbeddingProgress current = EmbeddingProgress.start(batches.size());
        progress.set(current);

        if (batches.isEmpty()) {
            return EmbeddingRunResult.empty();
        }

        int totalChunks = batches.stream().mapToInt(Batch::size).sum();
        log.info("Generating embeddings for {} chunks in {} batches with {}",
                totalChunks, batches.size(), provider.modelId());

        List<EmbeddedChunk> embedded = new ArrayList<>(totalChunks);
        boolean cancelled = false;

        for (int i = 0; i < batches.size(); i++) {
            if (cancellationRequested.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                log.warn("Embedding run cancelled before batch {}/{}, {} chunks embedded",
                        i + 1, batches.size(), embedded.size());
                cancelled = true;
                break;
            }

            Batch batch = batches.get(i);
            log.info("Processing batch {}/{} ({} chunks, {} tokens)",
                    i + 1, batches.size(), batch.size(), batch.tokenCount());

            try {
                embedded.addAll(embedBatch(batch, i));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Embedding run interrupted during batch {}/{}, {} chunks embedded",
                        i + 1, batches.size(), embedded.size());
                cancelled = true;
                break;
            } catch (RuntimeException e) {
                log.error("Embedding run aborted at batch {}/{} ({} chunks, {} tokens): {}",
                        i + 1, batches.size(), batch.size(), batch.tokenCount(), e.getMessage());
                throw new EmbeddingRunException(i, batch.size(), batch.tokenCount(), embedded.size(), e);
            }

            current = current.plus(batch, properties.getPricePerMillionTokens());
            progress.set(current);
            log.debug("Batch {} complete. Running total: {} tokens, ${}",
                    i + 1, current.tokensProcessed(), formatCost(current.estimatedCostUsd()));

            if (i < batches.size() - 1 && !pause(interBatchDelay)) {
                cancelled = true;
                break;
            }
        }

        log.info("Embeddings {}. Total: {} chunks, {} tokens, ${}",
                cancelled ? "cancelled" : "complete",
                embedded.size(), current.tokensProcessed(), formatCost(current.estimatedCostUsd()));
        return new EmbeddingRunResult(embedded, current, cancelled);
    }

    /**
     * Totals of the current or most recent run.
     */
    public EmbeddingProgress progress() {
        return progress.get();
    }

    private List<EmbeddedChunk> embedBatch(Batch batch, int batchIndex) throws InterruptedException {
        List<String> texts = batch.texts();

        List<float[]> vectors;
        try {
            vectors = provider.embed(texts);
        } catch (RateLimitedException e) {
            Duration retryDelay = properties.getRateLimitRetryDelay();
            log.warn("Rate limited on batch {}, retrying once in {} ms", batchIndex + 1, retryDelay.toMillis());
            sleeper.sleep(retryDelay.toMillis());
            vectors = provider.embed(texts);
        }

        if (vectors.size() != batch.size()) {
            throw new EmbeddingProviderException(
                    "Provider returned " + vectors.size() + " vectors for " + batch.size() + " texts");
        }

        List<EmbeddedChunk> result = new ArrayList<>(batch.size());
        for (int j = 0; j < batch.size(); j++) {
            TokenizedChunk tokenized = batch.chunks().get(j);
            result.add(EmbeddedChunk.create(
                    tokenized.chunk(),
                    vectors.get(j),
                    properties.getDimension(),
                    idGenerator.numericId(tokenized.chunk().stringId()),
                    tokenized.tokenCount()
            ));
        }
        return result;
    }

    /**
     * Sleeps between batches. Returns false if the thread was interrupted.
     */
    private boolean pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Embedding run interrupted between batches");
            return false;
        }
    }

    private static String formatCost(double cost) {
        return String.format("%.4f", cost);
    }
}
