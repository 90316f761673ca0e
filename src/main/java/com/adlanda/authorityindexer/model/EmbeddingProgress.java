package com.adlanda.authorityindexer.model;

/**
 * Running totals of an embedding run.
 *
 * @param batchesCompleted Batches embedded so far
 * @param totalBatches     Batches in the run
 * @param chunksEmbedded   Chunks embedded so far
 * @param tokensProcessed  Tokens sent to the provider so far
 * @param estimatedCostUsd Cost of the tokens processed so far
 */
public record EmbeddingProgress(
        int batchesCompleted,
        int totalBatches,
        int chunksEmbedded,
        long tokensProcessed,
        double estimatedCostUsd
) {
    public static EmbeddingProgress start(int totalBatches) {
        return new EmbeddingProgress(0, totalBatches, 0, 0, 0.0);
    }

    public static EmbeddingProgress idle() {
        return start(0);
    }

    /**
     * Returns the totals after one more batch has been embedded.
     */
    public EmbeddingProgress plus(Batch batch, double pricePerMillionTokens) {
        long tokens = tokensProcessed + batch.tokenCount();
        return new EmbeddingProgress(
                batchesCompleted + 1,
                totalBatches,
                chunksEmbedded + batch.size(),
                tokens,
                tokens / 1_000_000.0 * pricePerMillionTokens
        );
    }
}
