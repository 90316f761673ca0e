package com.adlanda.authorityindexer.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata supplied with an authority document before chunking.
 *
 * @param sourceType  Kind of authority (statute, regulation, bulletin)
 * @param citation    Authority citation, e.g. "26 U.S.C. § 195"
 * @param title       Document title
 * @param section     Section or regulation number
 * @param url         Link to the original source
 * @param versionDate Last modified date as published by the source
 * @param extraFields Additional source-specific fields
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DocumentMetadata(
        @NotNull(message = "Source type is required")
        SourceType sourceType,

        @NotBlank(message = "Citation is required")
        String citation,

        String title,
        String section,
        String url,
        String versionDate,
        Map<String, Object> extraFields
) {
    public DocumentMetadata {
        extraFields = extraFields == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extraFields));
    }

    /**
     * Creates metadata carrying only the fields needed for identifiers.
     */
    public static DocumentMetadata of(SourceType sourceType, String citation) {
        return new DocumentMetadata(sourceType, citation, null, null, null, null, Map.of());
    }
}
