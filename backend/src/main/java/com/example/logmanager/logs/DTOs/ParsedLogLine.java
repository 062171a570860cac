package com.example.logmanager.logs.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ParsedLogLine(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("level") String level,
        @JsonProperty("source") String source,
        @JsonProperty("message") String message
) {}
