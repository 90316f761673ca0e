package com.adlanda.authorityindexer.service.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Punctuation-based sentence splitting: breaks after '.', '!' or '?' followed by whitespace.
 *
 * Abbreviations such as "U.S.C. § 195" produce extra breaks; text after the last
 * terminator is kept as a final sentence.
 */
public class RegexSentenceSplitter implements SentenceSplitter {

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

    @Override
    public List<String> split(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return sentences;
        }

        for (String part : SENTENCE_BOUNDARY.split(text.strip())) {
            String sentence = part.strip();
            if (!sentence.isEmpty()) {
                sentences.add(sentence);
            }
        }
        return sentences;
    }
}
