package com.example.logmanager.logs.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

public record ChartData(
        @JsonProperty("labels") List<String> labels,
        @JsonProperty("values") List<Long> values
) implements Serializable {

    public long total() {
        return values.stream().mapToLong(Long::longValue).sum();
    }
}
