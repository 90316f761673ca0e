package com.adlanda.authorityindexer.config;

import com.adlanda.authorityindexer.service.chunking.BreakIteratorSentenceSplitter;
import com.adlanda.authorityindexer.service.chunking.RegexSentenceSplitter;
import com.adlanda.authorityindexer.service.chunking.SentenceSplitter;
import com.adlanda.authorityindexer.service.embedding.HeuristicTokenCounter;
import com.adlanda.authorityindexer.service.embedding.JTokkitTokenCounter;
import com.adlanda.authorityindexer.service.embedding.TokenCounter;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.util.Locale;
import java.util.Optional;

/**
 * Selects the pluggable pieces of the pipeline once, at startup.
 */
@Configuration
public class IndexerConfig {

    private static final Logger log = LoggerFactory.getLogger(IndexerConfig.class);

    @Bean
    public SentenceSplitter sentenceSplitter(ChunkingProperties properties) {
        return createSentenceSplitter(properties);
    }

    @Bean
    public TokenCounter tokenCounter(EmbeddingProperties properties) {
        TokenCounter counter = createTokenCounter(properties, Encodings.newDefaultEncodingRegistry());
        log.info("Token counting with {}", counter.name());
        return counter;
    }

    @Bean
    public Sleeper sleeper() {
        return new ThreadWaitSleeper();
    }

    static SentenceSplitter createSentenceSplitter(ChunkingProperties properties) {
        String mode = properties.getSentenceSplitter().trim().toLowerCase(Locale.ROOT);
        if ("linguistic".equals(mode)) {
            return new BreakIteratorSentenceSplitter(Locale.forLanguageTag(properties.getLocale()));
        }
        if ("regex".equals(mode)) {
            return new RegexSentenceSplitter();
        }
        throw new IllegalArgumentException(
                "Unknown sentence splitter '" + properties.getSentenceSplitter() + "', expected linguistic or regex");
    }

    /**
     * Precise mode resolves a JTokkit encoding from the model name, then from the
     * configured encoding name. If neither resolves, the heuristic is used and a
     * warning is logged, because it changes how chunks are batched.
     */
    static TokenCounter createTokenCounter(EmbeddingProperties properties, EncodingRegistry registry) {
        String mode = properties.getTokenizer().trim().toLowerCase(Locale.ROOT);
        if ("heuristic".equals(mode)) {
            return new HeuristicTokenCounter();
        }
        if (!"precise".equals(mode)) {
            throw new IllegalArgumentException(
                    "Unknown tokenizer '" + properties.getTokenizer() + "', expected precise or heuristic");
        }

        Optional<Encoding> encoding = registry.getEncodingForModel(properties.getModel())
                .or(() -> registry.getEncoding(properties.getTokenizerEncoding()));
        if (encoding.isPresent()) {
            return new JTokkitTokenCounter(encoding.get());
        }

        log.warn("No tokenizer encoding found for model '{}' or encoding '{}', falling back to character heuristic",
                properties.getModel(), properties.getTokenizerEncoding());
        return new HeuristicTokenCounter();
    }
}
