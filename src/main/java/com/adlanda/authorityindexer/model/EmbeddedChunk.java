package com.adlanda.authorityindexer.model;

import com.adlanda.authorityindexer.exception.DimensionMismatchException;

import java.util.List;

/**
 * A chunk with its embedding vector and legacy numeric id.
 *
 * @param chunk      The embedded chunk
 * @param embedding  Vector returned by the provider (configured dimension, 1536 for text-embedding-3-small)
 * @param numericId  Legacy 32-bit hash of the chunk's string id, used as vector index key
 * @param tokenCount Tokens counted for the chunk text
 */
public record EmbeddedChunk(
        Chunk chunk,
        List<Double> embedding,
        long numericId,
        int tokenCount
) {
    public EmbeddedChunk {
        embedding = List.copyOf(embedding);
    }

    /**
     * Creates an embedded chunk, failing if the vector does not have the expected dimension.
     */
    public static EmbeddedChunk create(Chunk chunk, float[] vector, int expectedDimension,
                                       long numericId, int tokenCount) {
        if (vector.length != expectedDimension) {
            throw new DimensionMismatchException(expectedDimension, vector.length);
        }
        return new EmbeddedChunk(chunk, toDoubleList(vector), numericId, tokenCount);
    }

    public String stringId() {
        return chunk.stringId();
    }

    private static List<Double> toDoubleList(float[] floats) {
        Double[] doubles = new Double[floats.length];
        for (int i = 0; i < floats.length; i++) {
            doubles[i] = (double) floats[i];
        }
        return List.of(doubles);
    }
}
