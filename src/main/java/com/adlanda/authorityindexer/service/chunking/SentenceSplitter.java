package com.adlanda.authorityindexer.service.chunking;

import java.util.List;

/**
 * Splits a paragraph into sentences for chunking paragraphs that are too large.
 */
public interface SentenceSplitter {

    /**
     * Returns the trimmed, non-empty sentences of the text in order.
     * Joining them with single spaces must not lose any non-whitespace character.
     */
    List<String> split(String text);
}
