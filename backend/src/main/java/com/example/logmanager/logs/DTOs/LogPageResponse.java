package com.example.logmanager.logs.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LogPageResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("logs") List<LogEntryResponse> logs,
        @JsonProperty("total") long total,
        @JsonProperty("limit") int limit,
        @JsonProperty("offset") int offset,
        @JsonProperty("page") int page,
        @JsonProperty("pageSize") int pageSize,
        @JsonProperty("query") AppliedQuery query
) {}
