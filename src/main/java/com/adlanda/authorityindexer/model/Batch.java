package com.adlanda.authorityindexer.model;

import java.util.List;

/**
 * Chunks sent to the embedding provider in one request.
 *
 * @param chunks     Chunks in submission order
 * @param tokenCount Sum of the chunks' token counts
 */
public record Batch(
        List<TokenizedChunk> chunks,
        int tokenCount
) {
    public Batch {
        chunks = List.copyOf(chunks);
    }

    public static Batch of(List<TokenizedChunk> chunks) {
        int tokens = chunks.stream().mapToInt(TokenizedChunk::tokenCount).sum();
        return new Batch(chunks, tokens);
    }

    public int size() {
        return chunks.size();
    }

    public List<String> texts() {
        return chunks.stream()
                .map(tc -> tc.chunk().text())
                .toList();
    }
}
