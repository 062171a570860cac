package com.example.logmanager.logs.analytics;

import java.time.Duration;
import java.util.Arrays;

public enum StatsPeriod {
    ONE_HOUR("1h", Duration.ofHours(1)),
    ONE_DAY("24h", Duration.ofHours(24)),
    SEVEN_DAYS("7d", Duration.ofDays(7)),
    THIRTY_DAYS("30d", Duration.ofDays(30));

    private final String value;
    private final Duration window;

    StatsPeriod(String value, Duration window) {
        this.value = value;
        this.window = window;
    }

    public String value() {
        return value;
    }

    public Duration window() {
        return window;
    }

    public long hours() {
        return window.toHours();
    }

    public static StatsPeriod fromValue(String value) {
        return Arrays.stream(values())
                .filter(period -> period.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid period '" + value + "', expected one of 1h, 24h, 7d, 30d"));
    }
}
