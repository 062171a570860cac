package com.example.logmanager.logs.analytics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum AnomalySeverity {
    CRITICAL(3.0),
    HIGH(2.0),
    MEDIUM(1.5);

    private final double minZScore;

    AnomalySeverity(double minZScore) {
        this.minZScore = minZScore;
    }

    public double minZScore() {
        return minZScore;
    }

    /** Highest severity whose threshold the absolute z-score reaches; empty below 1.5. */
    public static Optional<AnomalySeverity> forZScore(double zScore) {
        double magnitude = Math.abs(zScore);
        for (AnomalySeverity severity : values()) {
            if (magnitude >= severity.minZScore) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
