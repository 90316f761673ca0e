package com.adlanda.authorityindexer.repository;

import com.adlanda.authorityindexer.model.EmbeddedChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory index of embedded chunks, keyed by numeric id like the external vector index.
 *
 * Two different string ids hashing to the same numeric id would overwrite each
 * other in the external index without any error. This index reports such
 * collisions loudly instead.
 */
@Repository
public class InMemoryChunkIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChunkIndex.class);

    private final Map<Long, EmbeddedChunk> chunks = new ConcurrentHashMap<>();
    private final AtomicLong collisions = new AtomicLong();

    /**
     * Stores an embedded chunk, replacing any previous version with the same string id.
     */
    public void store(EmbeddedChunk chunk) {
        if (chunk.embedding().isEmpty()) {
            throw new IllegalArgumentException("Cannot store chunk without embedding");
        }

        EmbeddedChunk previous = chunks.put(chunk.numericId(), chunk);
        if (previous != null && !previous.stringId().equals(chunk.stringId())) {
            collisions.incrementAndGet();
            log.error("Numeric id collision: {} and {} both map to {}, the first was overwritten",
                    previous.stringId(), chunk.stringId(), chunk.numericId());
        }
    }

    /**
     * Stores multiple chunks.
     */
    public void storeAll(List<EmbeddedChunk> chunksToStore) {
        chunksToStore.forEach(this::store);
        log.info("Stored {} chunks in index", chunksToStore.size());
    }

    public Optional<EmbeddedChunk> findByNumericId(long numericId) {
        return Optional.ofNullable(chunks.get(numericId));
    }

    /**
     * Returns the total number of chunks stored.
     */
    public int size() {
        return chunks.size();
    }

    /**
     * Number of id collisions seen since startup.
     */
    public long collisionCount() {
        return collisions.get();
    }

    /**
     * Clears all chunks from the index.
     */
    public void clear() {
        chunks.clear();
    }
}
