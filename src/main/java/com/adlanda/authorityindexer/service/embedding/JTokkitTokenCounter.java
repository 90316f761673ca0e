package com.adlanda.authorityindexer.service.embedding;

import com.knuddels.jtokkit.api.Encoding;

/**
 * Exact token counts using a JTokkit BPE encoding (cl100k_base for the text-embedding-3 models).
 */
public class JTokkitTokenCounter implements TokenCounter {

    private final Encoding encoding;

    public JTokkitTokenCounter(Encoding encoding) {
        this.encoding = encoding;
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokens(text);
    }

    @Override
    public boolean isPrecise() {
        return true;
    }

    @Override
    public String name() {
        return "jtokkit:" + encoding.getName();
    }
}
