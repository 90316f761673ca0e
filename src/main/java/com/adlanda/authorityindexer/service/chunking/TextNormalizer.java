package com.adlanda.authorityindexer.service.chunking;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Whitespace cleanup applied to document text before chunking.
 *
 * Runs of blank lines collapse to a single paragraph break, runs of spaces
 * collapse to one space, and the result is trimmed. Normalizing twice gives
 * the same result as normalizing once.
 */
@Component
public class TextNormalizer {

    private static final Pattern MULTIPLE_NEWLINES = Pattern.compile("\n{2,}");
    private static final Pattern MULTIPLE_SPACES = Pattern.compile(" {2,}");

    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String collapsed = MULTIPLE_NEWLINES.matcher(text).replaceAll("\n\n");
        collapsed = MULTIPLE_SPACES.matcher(collapsed).replaceAll(" ");
        return collapsed.strip();
    }
}
