package com.adlanda.authorityindexer.service.chunking;

import com.adlanda.authorityindexer.config.ChunkingProperties;
import com.adlanda.authorityindexer.model.AuthorityDocument;
import com.adlanda.authorityindexer.model.Chunk;
import com.adlanda.authorityindexer.model.ChunkMetadata;
import com.adlanda.authorityindexer.model.DocumentMetadata;
import com.adlanda.authorityindexer.service.ChunkIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits authority documents into overlapping chunks for embedding.
 *
 * Strategy:
 * 1. Short documents (at most maxChunkSize characters) become a single chunk
 * 2. Paragraphs (separated by blank lines) are packed greedily up to maxChunkSize
 * 3. Paragraphs larger than maxChunkSize are packed sentence by sentence
 * 4. Each chunk after the first starts with the tail of the previous one, cut at a word boundary
 *
 * A chunk is at most maxChunkSize + overlapSize characters, unless a single sentence
 * is longer than maxChunkSize; such a sentence is kept whole.
 */
@Service
public class Chunker {

    private static final Logger log = LoggerFactory.getLogger(Chunker.class);

    private static final String PARAGRAPH_SEPARATOR = "\n\n";
    private static final String SENTENCE_SEPARATOR = " ";

    private final TextNormalizer textNormalizer;
    private final SentenceSplitter sentenceSplitter;
    private final ChunkIdGenerator idGenerator;
    private final ChunkingProperties properties;

    public Chunker(TextNormalizer textNormalizer,
                   SentenceSplitter sentenceSplitter,
                   ChunkIdGenerator idGenerator,
                   ChunkingProperties properties) {
        this.textNormalizer = textNormalizer;
        this.sentenceSplitter = sentenceSplitter;
        this.idGenerator = idGenerator;
        this.properties = properties;
    }

    /**
     * Chunks a document using the configured chunk and overlap sizes.
     */
    public List<Chunk> chunk(String text, DocumentMetadata metadata) {
        return chunk(text, metadata, properties.getMaxChunkSize(), properties.getOverlapSize());
    }

    /**
     * Chunks a document.
     *
     * @param text         Raw document text
     * @param metadata     Document metadata; source type and citation feed the chunk ids
     * @param maxChunkSize Maximum characters per chunk before overlap
     * @param overlapSize  Characters carried over from the previous chunk
     * @return Chunks in document order, empty if the text is blank
     */
    public List<Chunk> chunk(String text, DocumentMetadata metadata, int maxChunkSize, int overlapSize) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive, was " + maxChunkSize);
        }
        if (overlapSize < 0) {
            throw new IllegalArgumentException("overlapSize must not be negative, was " + overlapSize);
        }

        String normalized = textNormalizer.normalize(text);
        if (normalized.isEmpty()) {
            log.warn("Empty text provided for {}, no chunks produced", metadata.citation());
            return List.of();
        }

        List<String> pieces = normalized.length() <= maxChunkSize
                ? List.of(normalized)
                : split(normalized, metadata, maxChunkSize, overlapSize);

        log.debug("Split {} ({} chars) into {} chunks", metadata.citation(), normalized.length(), pieces.size());
        return toChunks(pieces, metadata);
    }

    /**
     * Chunks several documents, concatenating the results in input order.
     */
    public List<Chunk> chunkAll(List<AuthorityDocument> documents) {
        List<Chunk> allChunks = new ArrayList<>();
        for (AuthorityDocument document : documents) {
            allChunks.addAll(chunk(document.text(), document.metadata()));
        }
        return allChunks;
    }

    private List<String> split(String text, DocumentMetadata metadata, int maxChunkSize, int overlapSize) {
        ChunkBuffer buffer = new ChunkBuffer(maxChunkSize, overlapSize);

        for (String rawParagraph : text.split(PARAGRAPH_SEPARATOR)) {
            String paragraph = rawParagraph.strip();
            if (paragraph.isEmpty()) {
                continue;
            }

            if (paragraph.length() <= maxChunkSize) {
                buffer.append(paragraph, PARAGRAPH_SEPARATOR);
                continue;
            }

            // Paragraph too large on its own: pack its sentences instead
            String separator = PARAGRAPH_SEPARATOR;
            for (String sentence : sentenceSplitter.split(paragraph)) {
                if (sentence.length() > maxChunkSize) {
                    log.warn("Sentence of {} chars in {} exceeds max chunk size {}, keeping it as one oversized chunk",
                            sentence.length(), metadata.citation(), maxChunkSize);
                }
                buffer.append(sentence, separator);
                separator = SENTENCE_SEPARATOR;
            }
        }

        return buffer.finish();
    }

    private List<Chunk> toChunks(List<String> pieces, DocumentMetadata metadata) {
        int totalChunks = pieces.size();
        List<Chunk> chunks = new ArrayList<>(totalChunks);

        for (int index = 0; index < totalChunks; index++) {
            chunks.add(new Chunk(
                    pieces.get(index),
                    ChunkMetadata.of(metadata, index, totalChunks),
                    idGenerator.chunkId(metadata.sourceType(), metadata.citation(), index)
            ));
        }
        return chunks;
    }

    /**
     * Greedy accumulator for chunk text. Holds state for a single document only.
     */
    private static final class ChunkBuffer {

        private final int maxChunkSize;
        private final int overlapSize;
        private final List<String> completed = new ArrayList<>();
        private final StringBuilder current = new StringBuilder();

        ChunkBuffer(int maxChunkSize, int overlapSize) {
            this.maxChunkSize = maxChunkSize;
            this.overlapSize = overlapSize;
        }

        void append(String unit, String separator) {
            if (current.length() == 0) {
                current.append(unit);
                return;
            }

            if (current.length() + separator.length() + unit.length() <= maxChunkSize) {
                current.append(separator).append(unit);
                return;
            }

            String flushed = current.toString();
            completed.add(flushed);

            String overlap = overlapOf(flushed);
            current.setLength(0);
            if (!overlap.isEmpty()) {
                current.append(overlap).append(SENTENCE_SEPARATOR);
            }
            current.append(unit);
        }

        List<String> finish() {
            if (current.length() > 0) {
                completed.add(current.toString());
                current.setLength(0);
            }
            return completed;
        }

        /**
         * Tail of the flushed chunk to repeat at the start of the next one.
         * The last overlapSize characters, advanced past the first whitespace so the
         * leading word is never a fragment. Empty when that window has no whitespace.
         *
         * Always shorter than overlapSize, so overlap plus separator plus a full unit
         * stays within maxChunkSize + overlapSize. A flushed chunk shorter than
         * overlapSize is therefore repeated whole, while one of exactly overlapSize
         * characters goes through the window rule and loses its first word.
         */
        private String overlapOf(String flushed) {
            if (overlapSize == 0) {
                return "";
            }
            if (flushed.length() < overlapSize) {
                return flushed;
            }

            String window = flushed.substring(flushed.length() - overlapSize);
            for (int i = 0; i < window.length(); i++) {
                if (Character.isWhitespace(window.charAt(i))) {
                    return window.substring(i + 1).strip();
                }
            }
            return "";
        }
    }
}
