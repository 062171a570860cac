package com.example.logmanager.logs.models;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Levels accepted on ingestion. Stored lower-case, which is also how queries match them.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    /** Levels shown in the level distribution chart; anything else is counted as "other". */
    public static final List<String> CHARTED = List.of("error", "warning", "info", "debug");

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<LogLevel> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(level -> level.value().equals(value))
                .findFirst();
    }

    public boolean isProblem() {
        return this == WARNING || this == ERROR || this == CRITICAL;
    }
}
