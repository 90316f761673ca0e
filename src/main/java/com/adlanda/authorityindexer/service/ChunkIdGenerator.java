package com.adlanda.authorityindexer.service;

import com.adlanda.authorityindexer.model.SourceType;
import org.springframework.stereotype.Component;

/**
 * Generates chunk identifiers.
 *
 * The numeric id reproduces the 32-bit rolling hash of the legacy JavaScript
 * indexer bit for bit. Existing vector index entries are keyed by it, so any
 * change here silently duplicates or orphans stored points. Do not modify
 * without checking against stored ids.
 */
@Component
public class ChunkIdGenerator {

    /**
     * Builds the string id "{sourceType}-{citation}-chunk-{index}" with spaces,
     * slashes and periods in the citation replaced by hyphens.
     *
     * @param sourceType Source type code, e.g. "usc"
     * @param citation   Authority citation, e.g. "26 U.S.C. § 195"
     * @param chunkIndex Index of the chunk within its document
     * @return e.g. "usc-26-U-S-C--§-195-chunk-0"
     */
    public String chunkId(String sourceType, String citation, int chunkIndex) {
        String sanitizedCitation = citation
                .replace(' ', '-')
                .replace('/', '-')
                .replace('.', '-');
        return sourceType + "-" + sanitizedCitation + "-chunk-" + chunkIndex;
    }

    public String chunkId(SourceType sourceType, String citation, int chunkIndex) {
        return chunkId(sourceType.code(), citation, chunkIndex);
    }

    /**
     * Hashes a string id to the legacy numeric id.
     *
     * For each UTF-16 code unit: {@code hash = hash * 31 + c} in signed 32-bit
     * arithmetic, then the absolute value of the signed result. The absolute value
     * is taken in 64 bits so that {@link Integer#MIN_VALUE} maps to 2147483648,
     * matching JavaScript's {@code Math.abs}.
     *
     * @param stringId The string id to hash
     * @return Non-negative id, at most 2^31
     */
    public long numericId(String stringId) {
        int hash = 0;
        for (int i = 0; i < stringId.length(); i++) {
            hash = 31 * hash + stringId.charAt(i);
        }
        return Math.abs((long) hash);
    }

    public long numericChunkId(SourceType sourceType, String citation, int chunkIndex) {
        return numericId(chunkId(sourceType, citation, chunkIndex));
    }
}
