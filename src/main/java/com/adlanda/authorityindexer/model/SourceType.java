package com.adlanda.authorityindexer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of tax authority a document belongs to.
 *
 * The code is the prefix used in chunk identifiers and must not change,
 * since existing index entries are keyed by it.
 */
public enum SourceType {

    /** US Code Title 26 sections. */
    STATUTE("usc"),

    /** Treasury regulations, 26 CFR. */
    REGULATION("cfr"),

    /** Internal Revenue Bulletin items (rulings, procedures, notices). */
    BULLETIN("irb");

    private final String code;

    SourceType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Resolves a source type from its code ("usc") or enum name ("statute"), ignoring case.
     */
    @JsonCreator
    public static SourceType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Source type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SourceType type : values()) {
            if (type.code.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + value);
    }
}
