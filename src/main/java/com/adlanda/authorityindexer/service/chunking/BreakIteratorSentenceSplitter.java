package com.adlanda.authorityindexer.service.chunking;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Locale-aware sentence splitting backed by the JDK sentence {@link BreakIterator}.
 *
 * A new iterator is created per call since BreakIterator instances are not thread-safe.
 */
public class BreakIteratorSentenceSplitter implements SentenceSplitter {

    private final Locale locale;

    public BreakIteratorSentenceSplitter(Locale locale) {
        this.locale = locale;
    }

    @Override
    public List<String> split(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return sentences;
        }

        BreakIterator iterator = BreakIterator.getSentenceInstance(locale);
        iterator.setText(text);

        int start = iterator.first();
        for (int end = iterator.next(); end != BreakIterator.DONE; start = end, end = iterator.next()) {
            String sentence = text.substring(start, end).strip();
            if (!sentence.isEmpty()) {
                sentences.add(sentence);
            }
        }
        return sentences;
    }

    public Locale getLocale() {
        return locale;
    }
}
