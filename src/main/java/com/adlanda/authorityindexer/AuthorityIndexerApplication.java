package com.adlanda.authorityindexer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Authority Indexer - Main Application
 *
 * Turns extracted tax authority text (statutes, regulations, bulletins) into
 * overlapping chunks with stable ids, and embeds them in token-aware batches
 * ready for a vector index.
 *
 * This application uses:
 * - Spring Boot 3.4 with Java 17
 * - Spring AI for embedding generation via OpenAI
 * - JTokkit for token counting
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class AuthorityIndexerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthorityIndexerApplication.class, args);
    }
}
