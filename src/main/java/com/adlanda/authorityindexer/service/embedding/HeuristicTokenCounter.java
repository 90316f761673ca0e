package com.adlanda.authorityindexer.service.embedding;

/**
 * Character-based estimate of roughly one token per three characters.
 *
 * Errs on the high side for English legal text, which keeps batches under the token budget.
 */
public class HeuristicTokenCounter implements TokenCounter {

    private static final int CHARS_PER_TOKEN = 3;

    @Override
    public int count(String text) {
        int length = text == null ? 0 : text.length();
        return Math.max(1, length / CHARS_PER_TOKEN);
    }

    @Override
    public boolean isPrecise() {
        return false;
    }

    @Override
    public String name() {
        return "heuristic:chars/" + CHARS_PER_TOKEN;
    }

    /**
     * Characters that correspond to the given token count under this estimate.
     */
    public static int charsForTokens(int tokens) {
        return tokens * CHARS_PER_TOKEN;
    }
}
