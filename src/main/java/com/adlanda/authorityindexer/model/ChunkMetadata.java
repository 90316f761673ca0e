package com.adlanda.authorityindexer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata attached to a single chunk: the document metadata plus the chunk's position.
 *
 * @param chunkIndex  Zero-based position of the chunk within its document
 * @param totalChunks Number of chunks the document was split into
 */
public record ChunkMetadata(
        SourceType sourceType,
        String citation,
        int chunkIndex,
        int totalChunks,
        String title,
        String section,
        String url,
        String versionDate,
        Map<String, Object> extraFields
) {
    public ChunkMetadata {
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("chunkIndex must be >= 0, was " + chunkIndex);
        }
        if (totalChunks < 1 || chunkIndex >= totalChunks) {
            throw new IllegalArgumentException(
                    "chunkIndex " + chunkIndex + " out of range for totalChunks " + totalChunks);
        }
        extraFields = extraFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extraFields));
    }

    public static ChunkMetadata of(DocumentMetadata document, int chunkIndex, int totalChunks) {
        return new ChunkMetadata(
                document.sourceType(),
                document.citation(),
                chunkIndex,
                totalChunks,
                document.title(),
                document.section(),
                document.url(),
                document.versionDate(),
                document.extraFields()
        );
    }
}
