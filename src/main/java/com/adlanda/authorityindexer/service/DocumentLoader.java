package com.adlanda.authorityindexer.service;

import com.adlanda.authorityindexer.config.IngestionProperties;
import com.adlanda.authorityindexer.exception.DocumentLoadException;
import com.adlanda.authorityindexer.model.AuthorityDocument;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads extracted authority documents from the configured docs directory.
 *
 * Each .json file holds either one document or an array of documents:
 * {"text": "...", "metadata": {"source_type": "usc", "citation": "26 U.S.C. § 195", ...}}
 */
@Service
public class DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    private static final TypeReference<List<AuthorityDocument>> DOCUMENT_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final IngestionProperties properties;

    public DocumentLoader(ObjectMapper objectMapper, IngestionProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Loads every document under the docs directory, in file name order.
     * Files that fail to parse are logged and skipped.
     */
    public List<AuthorityDocument> loadAll() {
        Path docsDir = Path.of(properties.getDocsPath());

        if (!Files.exists(docsDir)) {
            log.warn("Docs directory does not exist: {}", docsDir);
            return List.of();
        }

        List<AuthorityDocument> documents = new ArrayList<>();

        try (Stream<Path> paths = Files.walk(docsDir)) {
            List<Path> files = paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();

            for (Path file : files) {
                try {
                    List<AuthorityDocument> loaded = loadFile(file);
                    documents.addAll(loaded);
                    log.info("Loaded {} documents from {}", loaded.size(), file.getFileName());
                } catch (DocumentLoadException e) {
                    log.error("Skipping {}: {}", file, e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            throw new DocumentLoadException(docsDir, e);
        }

        log.info("Total documents loaded: {}", documents.size());
        return documents;
    }

    /**
     * Reads one JSON file. Documents without a source type or citation are dropped.
     */
    public List<AuthorityDocument> loadFile(Path file) {
        List<AuthorityDocument> parsed;
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            parsed = root.isArray()
                    ? objectMapper.convertValue(root, DOCUMENT_LIST)
                    : List.of(objectMapper.treeToValue(root, AuthorityDocument.class));
        } catch (IOException | IllegalArgumentException e) {
            throw new DocumentLoadException(file, e);
        }

        List<AuthorityDocument> valid = new ArrayList<>(parsed.size());
        for (AuthorityDocument document : parsed) {
            if (document.metadata() == null
                    || document.metadata().sourceType() == null
                    || document.metadata().citation() == null
                    || document.metadata().citation().isBlank()) {
                log.warn("Skipping document without source type or citation in {}", file.getFileName());
                continue;
            }
            valid.add(document);
        }
        return valid;
    }
}
