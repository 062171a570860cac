package com.example.logmanager.logs.DTOs;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.Map;

/**
 * Body of a create-log call. Only these fields can reach storage; missing ones are filled in
 * by {@link com.example.logmanager.logs.services.LogIngestService}.
 */
public record LogEntryRequest(
        String level,
        @NotBlank(message = "message is required")
        @Size(max = 10000)
        String message,
        @Size(max = 255)
        String source,
        Instant timestamp,
        @Size(max = 255)
        String category,
        Map<String, Object> metadata,
        String ip) {

    public static final String DEFAULT_LEVEL = "info";
    public static final String DEFAULT_SOURCE = "api";

    public LogEntryRequest withDefaults(String clientIp, Instant now) {
        return new LogEntryRequest(
                level == null || level.isBlank() ? DEFAULT_LEVEL : level,
                message,
                source == null || source.isBlank() ? DEFAULT_SOURCE : source,
                timestamp == null ? now : timestamp,
                category,
                metadata,
                ip == null || ip.isBlank() ? (clientIp == null ? "unknown" : clientIp) : ip
        );
    }
}
