package com.adlanda.authorityindexer.model;

/**
 * Summary of one ingestion run over the docs directory.
 */
public record IngestionSummary(
        int documents,
        int chunks,
        int batches,
        long tokens,
        double estimatedCostUsd,
        boolean cancelled
) {
    public static IngestionSummary of(int documents, int chunks, EmbeddingRunResult result) {
        EmbeddingProgress progress = result.progress();
        return new IngestionSummary(
                documents,
                chunks,
                progress.batchesCompleted(),
                progress.tokensProcessed(),
                progress.estimatedCostUsd(),
                result.cancelled()
        );
    }
}
