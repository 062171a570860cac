package com.example.logmanager.logs.DTOs;

import com.example.logmanager.logs.analytics.AnomalyFlag;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

public record AnomalyResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("period") String period,
        @JsonProperty("anomalies") List<AnomalyFlag> anomalies
) implements Serializable {}
