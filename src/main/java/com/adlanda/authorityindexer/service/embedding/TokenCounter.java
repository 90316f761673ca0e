package com.adlanda.authorityindexer.service.embedding;

/**
 * Counts tokens the way the embedding model will.
 *
 * One implementation is chosen at startup and used for the whole run,
 * so batch sizes stay consistent.
 */
public interface TokenCounter {

    int count(String text);

    /**
     * True when counts come from the model's own tokenizer rather than an estimate.
     */
    boolean isPrecise();

    /**
     * Short description for logs, e.g. "jtokkit:cl100k_base".
     */
    String name();
}
