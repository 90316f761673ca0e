package com.adlanda.authorityindexer.model;

/**
 * A chunk together with the token count used for batching.
 */
public record TokenizedChunk(Chunk chunk, int tokenCount) {}
