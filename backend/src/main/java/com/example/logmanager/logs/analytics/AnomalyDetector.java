package com.example.logmanager.logs.analytics;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Z-score outlier detection over a series of bucket counts.
 *
 * <p>Uses the population standard deviation of the whole series. A flat series (deviation 0)
 * never produces a flag.
 */
@Component
public class AnomalyDetector {

    public List<BucketScore> score(List<Long> counts) {
        List<BucketScore> scores = new ArrayList<>(counts.size());
        if (counts.isEmpty()) {
            return scores;
        }

        double mean = counts.stream().mapToLong(Long::longValue).average().orElse(0);
        double variance = counts.stream()
                .mapToDouble(count -> Math.pow(count - mean, 2))
                .sum() / counts.size();
        double stdDev = Math.sqrt(variance);

        for (int i = 0; i < counts.size(); i++) {
            long count = counts.get(i);
            double zScore = stdDev == 0 ? 0 : (count - mean) / stdDev;
            AnomalySeverity severity = AnomalySeverity.forZScore(zScore).orElse(null);
            scores.add(new BucketScore(i, count, mean, stdDev, zScore, severity));
        }
        return scores;
    }
}
