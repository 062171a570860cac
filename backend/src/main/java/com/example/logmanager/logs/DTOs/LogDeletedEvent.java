package com.example.logmanager.logs.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pushed to subscribers when logs are removed, either one by id or a bulk delete by query.
 */
public record LogDeletedEvent(
        @JsonProperty("id") Long id,
        @JsonProperty("query") String query,
        @JsonProperty("deleted") int deleted
) {}
