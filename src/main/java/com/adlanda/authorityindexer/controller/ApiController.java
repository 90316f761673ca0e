package com.adlanda.authorityindexer.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api/v1")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
                "service", "Authority Indexer",
                "version", appVersion,
                "endpoints", Map.of(
                        "chunks", "POST /api/v1/chunks - Preview the chunks of one document",
                        "estimate", "POST /api/v1/estimate - Estimate tokens and cost for documents",
                        "ingest", "POST /api/v1/ingest - Embed and index documents",
                        "cancel", "POST /api/v1/ingest/cancel - Stop the active ingestion run",
                        "index", "GET /api/v1/index - Index size and run progress",
                        "health", "GET /actuator/health - Health check"
                )
        ));
    }
}
