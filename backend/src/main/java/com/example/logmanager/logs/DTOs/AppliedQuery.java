package com.example.logmanager.logs.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Describes how the filters of a request were applied: {@code structured} when the query
 * language was used, {@code legacy} when the discrete filters were.
 */
public record AppliedQuery(
        @JsonProperty("q") String q,
        @JsonProperty("mode") String mode,
        @JsonProperty("where") String where) {

    public static final String STRUCTURED = "structured";
    public static final String LEGACY = "legacy";
}
