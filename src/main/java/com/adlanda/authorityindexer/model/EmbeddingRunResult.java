package com.adlanda.authorityindexer.model;

import java.util.List;

/**
 * Outcome of an embedding run that was not aborted.
 *
 * @param embeddedChunks Records produced, in input order
 * @param progress       Totals at the end of the run
 * @param cancelled      True when the run stopped early on request
 */
public record EmbeddingRunResult(
        List<EmbeddedChunk> embeddedChunks,
        EmbeddingProgress progress,
        boolean cancelled
) {
    public EmbeddingRunResult {
        embeddedChunks = List.copyOf(embeddedChunks);
    }

    public static EmbeddingRunResult empty() {
        return new EmbeddingRunResult(List.of(), EmbeddingProgress.idle(), false);
    }
}
