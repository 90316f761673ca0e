package com.adlanda.authorityindexer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for document ingestion.
 *
 * Maps to properties prefixed with 'indexer.ingestion' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "indexer.ingestion")
public class IngestionProperties {

    /**
     * Whether ingestion runs at startup.
     * When false, ingestion only runs when triggered through the API.
     */
    private boolean enabled = false;

    /**
     * Directory holding the extracted authority documents as JSON files.
     */
    private String docsPath = "./docs";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDocsPath() {
        return docsPath;
    }

    public void setDocsPath(String docsPath) {
        this.docsPath = docsPath;
    }
}
