package com.example.logmanager.logs.DTOs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Response of the stats endpoint. Only the fields matching the requested grouping are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatsResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("period") String period,
        @JsonProperty("groupBy") String groupBy,
        @JsonProperty("labels") List<String> labels,
        @JsonProperty("values") List<Long> values,
        @JsonProperty("byLevel") Map<String, Long> byLevel,
        @JsonProperty("bySource") Map<String, Long> bySource,
        @JsonProperty("total") long total
) implements Serializable {

    public static StatsResponse series(String period, String groupBy, ChartData data) {
        return new StatsResponse(true, period, groupBy, data.labels(), data.values(), null, null, data.total());
    }

    public static StatsResponse byLevel(String period, Map<String, Long> counts, long total) {
        return new StatsResponse(true, period, "level", null, null, counts, null, total);
    }

    public static StatsResponse bySource(String period, Map<String, Long> counts, long total) {
        return new StatsResponse(true, period, "source", null, null, null, counts, total);
    }
}
