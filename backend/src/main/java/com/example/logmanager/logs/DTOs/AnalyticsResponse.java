package com.example.logmanager.logs.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

public record AnalyticsResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("totalLogs") long totalLogs,
        @JsonProperty("errorLogs") long errorLogs,
        @JsonProperty("avgPerHour") long avgPerHour,
        @JsonProperty("activeSources") long activeSources,
        @JsonProperty("hourlyData") ChartData hourlyData,
        @JsonProperty("severityData") ChartData severityData,
        @JsonProperty("categoryData") ChartData categoryData
) implements Serializable {}
