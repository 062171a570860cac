package com.example.logmanager.logs.analytics;

/**
 * @param severity null when the bucket is within normal range
 */
public record BucketScore(int index, long count, double mean, double stdDev, double zScore,
                          AnomalySeverity severity) {

    public boolean flagged() {
        return severity != null;
    }
}
