package com.example.logmanager.logs.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

public record LogEntryResponse(
        @JsonProperty("id") Long id,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("level") String level,
        @JsonProperty("source") String source,
        @JsonProperty("message") String message,
        @JsonProperty("ip") String ip,
        @JsonProperty("category") String category,
        @JsonProperty("metadata") Map<String, Object> metadata
) implements Serializable {}
