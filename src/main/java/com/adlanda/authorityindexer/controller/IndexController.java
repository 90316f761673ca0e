package com.adlanda.authorityindexer.controller;

import com.adlanda.authorityindexer.model.AuthorityDocument;
import com.adlanda.authorityindexer.model.ChunkPreview;
import com.adlanda.authorityindexer.model.CostEstimate;
import com.adlanda.authorityindexer.model.EmbeddingProgress;
import com.adlanda.authorityindexer.model.IngestionSummary;
import com.adlanda.authorityindexer.repository.InMemoryChunkIndex;
import com.adlanda.authorityindexer.service.IngestionService;
import com.adlanda.authorityindexer.service.embedding.EmbeddingOrchestrator;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for chunk previews, cost estimates and ingestion runs.
 */
@RestController
@RequestMapping("/api/v1")
public class IndexController {

    private final IngestionService ingestionService;
    private final InMemoryChunkIndex chunkIndex;
    private final EmbeddingOrchestrator orchestrator;

    public IndexController(IngestionService ingestionService,
                           InMemoryChunkIndex chunkIndex,
                           EmbeddingOrchestrator orchestrator) {
        this.ingestionService = ingestionService;
        this.chunkIndex = chunkIndex;
        this.orchestrator = orchestrator;
    }

    /**
     * Chunks one document and returns the chunks with their ids and token counts.
     */
    @PostMapping("/chunks")
    public ResponseEntity<List<ChunkPreview>> chunks(@Valid @RequestBody AuthorityDocument document) {
        return ResponseEntity.ok(ingestionService.preview(document));
    }

    @PostMapping("/estimate")
    public ResponseEntity<CostEstimate> estimate(@Valid @RequestBody List<@Valid AuthorityDocument> documents) {
        return ResponseEntity.ok(ingestionService.estimate(documents));
    }

    /**
     * Embeds and indexes the posted documents, or the docs directory when the body is absent.
     */
    @PostMapping("/ingest")
    public ResponseEntity<IngestionSummary> ingest(
            @Valid @RequestBody(required = false) List<@Valid AuthorityDocument> documents) {
        IngestionSummary summary = documents == null
                ? ingestionService.ingestAllDocuments()
                : ingestionService.ingest(documents);
        return ResponseEntity.ok(summary);
    }

    @PostMapping("/ingest/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        boolean cancelling = ingestionService.requestCancellation();
        return ResponseEntity.status(cancelling ? HttpStatus.ACCEPTED : HttpStatus.OK)
                .body(Map.of("cancelling", cancelling));
    }

    @GetMapping("/index")
    public ResponseEntity<Map<String, Object>> index() {
        EmbeddingProgress progress = orchestrator.progress();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("totalChunks", chunkIndex.size());
        body.put("collisions", chunkIndex.collisionCount());
        body.put("status", chunkIndex.size() > 0 ? "indexed" : "empty");
        body.put("running", ingestionService.isRunning());
        body.put("progress", progress);
        return ResponseEntity.ok(body);
    }
}
