package com.adlanda.authorityindexer.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * A document as handed over by the upstream fetchers: extracted text plus metadata.
 */
public record AuthorityDocument(
        String text,

        @Valid
        @NotNull(message = "Metadata is required")
        DocumentMetadata metadata
) {}
