package com.adlanda.authorityindexer.service;

import com.adlanda.authorityindexer.config.EmbeddingProperties;
import com.adlanda.authorityindexer.exception.EmbeddingRunException;
import com.adlanda.authorityindexer.exception.IngestionInProgressException;
import com.adlanda.authorityindexer.health.IngestionHealthIndicator;
import com.adlanda.authorityindexer.model.AuthorityDocument;
import com.adlanda.authorityindexer.model.Batch;
import com.adlanda.authorityindexer.model.Chunk;
import com.adlanda.authorityindexer.model.ChunkPreview;
import com.adlanda.authorityindexer.model.CostEstimate;
import com.adlanda.authorityindexer.model.EmbeddingRunResult;
import com.adlanda.authorityindexer.model.IngestionSummary;
import com.adlanda.authorityindexer.model.TokenizedChunk;
import com.adlanda.authorityindexer.repository.InMemoryChunkIndex;
import com.adlanda.authorityindexer.service.chunking.Chunker;
import com.adlanda.authorityindexer.service.embedding.BatchBuilder;
import com.adlanda.authorityindexer.service.embedding.EmbeddingOrchestrator;
import com.adlanda.authorityindexer.service.embedding.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the ingestion pipeline: load, chunk, batch, embed, index.
 *
 * Only one run executes at a time. A run can be cancelled between batches.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final DocumentLoader documentLoader;
    private final Chunker chunker;
    private final BatchBuilder batchBuilder;
    private final EmbeddingOrchestrator orchestrator;
    private final InMemoryChunkIndex chunkIndex;
    private final ChunkIdGenerator idGenerator;
    private final TokenCounter tokenCounter;
    private final EmbeddingProperties embeddingProperties;
    private final IngestionHealthIndicator healthIndicator;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    public IngestionService(DocumentLoader documentLoader,
                            Chunker chunker,
                            BatchBuilder batchBuilder,
                            EmbeddingOrchestrator orchestrator,
                            InMemoryChunkIndex chunkIndex,
                            ChunkIdGenerator idGenerator,
                            TokenCounter tokenCounter,
                            EmbeddingProperties embeddingProperties,
                            IngestionHealthIndicator healthIndicator) {
        this.documentLoader = documentLoader;
        this.chunker = chunker;
        this.batchBuilder = batchBuilder;
        this.orchestrator = orchestrator;
        this.chunkIndex = chunkIndex;
        this.idGenerator = idGenerator;
        this.tokenCounter = tokenCounter;
        this.embeddingProperties = embeddingProperties;
        this.healthIndicator = healthIndicator;
    }

    /**
     * Ingests every document in the configured docs directory.
     */
    public IngestionSummary ingestAllDocuments() {
        List<AuthorityDocument> documents;
        try {
            documents = documentLoader.loadAll();
        } catch (RuntimeException e) {
            healthIndicator.markUnhealthy(e.getMessage());
            throw e;
        }
        return ingest(documents);
    }

    /**
     * Chunks, embeds and indexes the given documents.
     * Any failure after the run starts marks ingestion health DOWN before it propagates.
     *
     * @throws IngestionInProgressException if another run is active
     * @throws EmbeddingRunException        if embedding fails fatally; nothing is indexed
     */
    public IngestionSummary ingest(List<AuthorityDocument> documents) {
        if (!running.compareAndSet(false, true)) {
            throw new IngestionInProgressException();
        }
        try {
            cancelRequested.set(false);

            if (documents.isEmpty()) {
                log.warn("No documents found to ingest");
                IngestionSummary empty = IngestionSummary.of(0, 0, EmbeddingRunResult.empty());
                healthIndicator.markHealthy(empty);
                return empty;
            }

            List<Chunk> chunks = chunker.chunkAll(documents);
            log.info("Total chunks created: {} from {} documents", chunks.size(), documents.size());

            List<Batch> batches = batchBuilder.build(chunks);
            log.info("Created {} batches", batches.size());

            EmbeddingRunResult result = orchestrator.run(
                    batches, embeddingProperties.getInterBatchDelay(), cancelRequested::get);
            chunkIndex.storeAll(result.embeddedChunks());

            IngestionSummary summary = IngestionSummary.of(documents.size(), chunks.size(), result);
            healthIndicator.markHealthy(summary);
            log.info("Ingestion {}: {} chunks indexed, {} tokens, ${}",
                    summary.cancelled() ? "cancelled" : "complete",
                    result.embeddedChunks().size(), summary.tokens(),
                    String.format("%.4f", summary.estimatedCostUsd()));
            return summary;
        } catch (RuntimeException e) {
            healthIndicator.markUnhealthy(e.getMessage());
            throw e;
        } finally {
            running.set(false);
        }
    }

    /**
     * Asks the active run to stop before its next batch.
     *
     * @return true if a run was active
     */
    public boolean requestCancellation() {
        if (!running.get()) {
            return false;
        }
        cancelRequested.set(true);
        log.info("Cancellation requested for the active ingestion run");
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Chunks a single document without embedding it.
     */
    public List<ChunkPreview> preview(AuthorityDocument document) {
        return chunker.chunk(document.text(), document.metadata()).stream()
                .map(chunk -> new ChunkPreview(
                        chunk.stringId(),
                        idGenerator.numericId(chunk.stringId()),
                        chunk.metadata().chunkIndex(),
                        chunk.metadata().totalChunks(),
                        chunk.length(),
                        tokenCounter.count(chunk.text()),
                        chunk.text()))
                .toList();
    }

    /**
     * Estimates tokens and cost of embedding the documents, without calling the provider.
     */
    public CostEstimate estimate(List<AuthorityDocument> documents) {
        List<Chunk> chunks = chunker.chunkAll(documents);
        List<Batch> batches = batchBuilder.build(chunks);

        long tokens = batches.stream()
                .flatMap(batch -> batch.chunks().stream())
                .mapToLong(TokenizedChunk::tokenCount)
                .sum();
        double cost = tokens / 1_000_000.0 * embeddingProperties.getPricePerMillionTokens();

        return new CostEstimate(documents.size(), chunks.size(), batches.size(), tokens, cost,
                tokenCounter.isPrecise());
    }
}
