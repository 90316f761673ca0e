package com.adlanda.authorityindexer.model;

/**
 * Dry-run estimate of what embedding a set of documents would cost.
 *
 * @param documents        Documents considered
 * @param chunks           Chunks produced
 * @param batches          Provider requests needed
 * @param tokens           Tokens counted after truncation
 * @param estimatedCostUsd Price of those tokens
 * @param preciseTokenizer False when token counts come from the character heuristic
 */
public record CostEstimate(
        int documents,
        int chunks,
        int batches,
        long tokens,
        double estimatedCostUsd,
        boolean preciseTokenizer
) {}
