package com.adlanda.authorityindexer;

import com.adlanda.authorityindexer.repository.InMemoryChunkIndex;
import com.adlanda.authorityindexer.service.embedding.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2) // Run after IngestionRunner
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final InMemoryChunkIndex chunkIndex;
    private final TokenCounter tokenCounter;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(InMemoryChunkIndex chunkIndex, TokenCounter tokenCounter) {
        this.chunkIndex = chunkIndex;
        this.tokenCounter = tokenCounter;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            Authority Indexer v{}
            Index: {} chunks
            Tokenizer: {} (precise: {})

            API Endpoints:
              GET  http://localhost:{}/api/v1
              POST http://localhost:{}/api/v1/chunks
              POST http://localhost:{}/api/v1/estimate
              POST http://localhost:{}/api/v1/ingest
              GET  http://localhost:{}/api/v1/index

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, chunkIndex.size(), tokenCounter.name(), tokenCounter.isPrecise(),
            port, port, port, port, port, port
        );
    }
}
