package com.adlanda.authorityindexer.model;

/**
 * A chunk as returned by the preview endpoint, before any embedding.
 */
public record ChunkPreview(
        String stringId,
        long numericId,
        int chunkIndex,
        int totalChunks,
        int length,
        int tokenCount,
        String text
) {}
