package com.example.logmanager.logs.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

public record AnomalyFlag(
        @JsonProperty("hour") Instant hour,
        @JsonProperty("level") String level,
        @JsonProperty("count") long count,
        @JsonProperty("mean") double mean,
        @JsonProperty("stdDev") double stdDev,
        @JsonProperty("zScore") double zScore,
        @JsonProperty("severity") AnomalySeverity severity
) implements Serializable {}
