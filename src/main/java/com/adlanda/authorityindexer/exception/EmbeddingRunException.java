package com.adlanda.authorityindexer.exception;

/**
 * Fatal failure of an embedding run.
 *
 * Carries enough position information to resume the run by hand:
 * the failing batch, its size and token count, and how many chunks
 * had been embedded before it. Records produced before the failure are discarded.
 */
public class EmbeddingRunException extends RuntimeException {

    private final int batchIndex;
    private final int batchChunkCount;
    private final int batchTokenCount;
    private final int embeddedChunkCount;

    public EmbeddingRunException(int batchIndex, int batchChunkCount, int batchTokenCount,
                                 int embeddedChunkCount, Throwable cause) {
        super(String.format("Embedding run aborted at batch %d (%d chunks, %d tokens) after %d chunks embedded: %s",
                batchIndex + 1, batchChunkCount, batchTokenCount, embeddedChunkCount, cause.getMessage()), cause);
        this.batchIndex = batchIndex;
        this.batchChunkCount = batchChunkCount;
        this.batchTokenCount = batchTokenCount;
        this.embeddedChunkCount = embeddedChunkCount;
    }

    /**
     * Zero-based index of the batch that failed.
     */
    public int getBatchIndex() {
        return batchIndex;
    }

    public int getBatchChunkCount() {
        return batchChunkCount;
    }

    public int getBatchTokenCount() {
        return batchTokenCount;
    }

    public int getEmbeddedChunkCount() {
        return embeddedChunkCount;
    }
}
