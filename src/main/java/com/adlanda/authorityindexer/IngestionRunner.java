package com.adlanda.authorityindexer;

import com.adlanda.authorityindexer.config.IngestionProperties;
import com.adlanda.authorityindexer.model.IngestionSummary;
import com.adlanda.authorityindexer.service.IngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Runs document ingestion on application startup when enabled.
 *
 * A failed run is logged and leaves the application up, so the index
 * can be rebuilt through the API.
 */
@Component
@Order(1) // Run before StartupInfoLogger
public class IngestionRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(IngestionRunner.class);

    private final IngestionService ingestionService;
    private final IngestionProperties properties;

    public IngestionRunner(IngestionService ingestionService, IngestionProperties properties) {
        this.ingestionService = ingestionService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isEnabled()) {
            log.info("Startup ingestion disabled");
            return;
        }

        log.info("Starting document ingestion from {}...", properties.getDocsPath());

        try {
            IngestionSummary summary = ingestionService.ingestAllDocuments();
            log.info("Startup ingestion finished: {} documents, {} chunks", summary.documents(), summary.chunks());
        } catch (Exception e) {
            log.error("Failed to ingest documents: {}", e.getMessage(), e);
        }
    }
}
