package com.example.logmanager.logs.analytics;

import java.util.Arrays;
import java.util.Locale;

public enum StatsGrouping {
    HOUR,
    DAY,
    LEVEL,
    SOURCE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static StatsGrouping fromValue(String value) {
        return Arrays.stream(values())
                .filter(grouping -> grouping.value().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid groupBy '" + value + "', expected one of hour, day, level, source"));
    }
}
