package com.adlanda.authorityindexer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for chunking.
 *
 * Maps to properties prefixed with 'indexer.chunking' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "indexer.chunking")
public class ChunkingProperties {

    /**
     * Maximum characters per chunk, not counting the overlap carried from the previous chunk.
     */
    private int maxChunkSize = 2000;

    /**
     * Characters repeated from the end of one chunk at the start of the next.
     */
    private int overlapSize = 200;

    /**
     * Sentence splitter used for oversized paragraphs: 'linguistic' or 'regex'.
     */
    private String sentenceSplitter = "linguistic";

    /**
     * Locale (BCP 47 tag) for the linguistic sentence splitter.
     */
    private String locale = "en-US";

    public int getMaxChunkSize() {
        return maxChunkSize;
    }

    public void setMaxChunkSize(int maxChunkSize) {
        this.maxChunkSize = maxChunkSize;
    }

    public int getOverlapSize() {
        return overlapSize;
    }

    public void setOverlapSize(int overlapSize) {
        this.overlapSize = overlapSize;
    }

    public String getSentenceSplitter() {
        return sentenceSplitter;
    }

    public void setSentenceSplitter(String sentenceSplitter) {
        this.sentenceSplitter = sentenceSplitter;
    }

    public String getLocale() {
        return locale;
    }

    public void setLocale(String locale) {
        this.locale = locale;
    }
}
