package com.example.logmanager.logs.analytics;

import com.example.logmanager.config.LogManagerProperties;
import com.example.logmanager.logs.DTOs.AnalyticsResponse;
import com.example.logmanager.logs.DTOs.ChartData;
import com.example.logmanager.logs.DTOs.LogEntryResponse;
import com.example.logmanager.logs.models.LogLevel;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Groups log rows into the buckets the dashboard charts consume. Every grouping has a fixed
 * key set that is zero-filled, so charts keep their shape when there is no activity.
 */
@Component
public class LogAnalyticsAggregator {

    public static final String OTHER_LEVEL = "other";
    public static final String DEFAULT_CATEGORY = "System";

    private final ZoneId zone;
    private final int topN;
    private final AnomalyDetector anomalyDetector;

    public LogAnalyticsAggregator(LogManagerProperties properties, AnomalyDetector anomalyDetector) {
        this.zone = properties.getAnalytics().getZone();
        this.topN = properties.getAnalytics().getTopN();
        this.anomalyDetector = anomalyDetector;
    }

    public ChartData hourly(Collection<LogEntryResponse> logs) {
        Map<Integer, Long> counts = new HashMap<>();
        for (LogEntryResponse log : logs) {
            if (log.timestamp() != null) {
                counts.merge(log.timestamp().atZone(zone).getHour(), 1L, Long::sum);
            }
        }
        return hourlyFromCounts(counts);
    }

    /**
     * @param countsByHour hour of day (0-23) to count, as returned by a grouped storage query
     */
    public ChartData hourlyFromCounts(Map<Integer, Long> countsByHour) {
        List<String> labels = new ArrayList<>(24);
        List<Long> values = new ArrayList<>(24);
        for (int hour = 0; hour < 24; hour++) {
            labels.add(String.format("%02d:00", hour));
            values.add(countsByHour.getOrDefault(hour, 0L));
        }
        return new ChartData(labels, values);
    }

    public ChartData daily(Collection<LogEntryResponse> logs, LocalDate from, LocalDate to) {
        Map<LocalDate, Long> counts = new HashMap<>();
        for (LogEntryResponse log : logs) {
            if (log.timestamp() != null) {
                counts.merge(log.timestamp().atZone(zone).toLocalDate(), 1L, Long::sum);
            }
        }

        List<String> labels = new ArrayList<>();
        List<Long> values = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            labels.add(day.toString());
            values.add(counts.getOrDefault(day, 0L));
        }
        return new ChartData(labels, values);
    }

    public ChartData daily(Collection<LogEntryResponse> logs, Instant from, Instant to) {
        return daily(logs, from.atZone(zone).toLocalDate(), to.atZone(zone).toLocalDate());
    }

    /**
     * Counts per charted level. Unknown and missing levels, critical included, land in
     * {@value #OTHER_LEVEL} instead of being dropped.
     */
    public Map<String, Long> levelDistribution(Collection<LogEntryResponse> logs) {
        Map<String, Long> counts = new LinkedHashMap<>();
        LogLevel.CHARTED.forEach(level -> counts.put(level, 0L));
        counts.put(OTHER_LEVEL, 0L);

        for (LogEntryResponse log : logs) {
            String level = log.level() == null ? OTHER_LEVEL : log.level().toLowerCase(Locale.ROOT);
            counts.merge(LogLevel.CHARTED.contains(level) ? level : OTHER_LEVEL, 1L, Long::sum);
        }
        return counts;
    }

    public Map<String, Long> topSources(Collection<LogEntryResponse> logs) {
        return topN(logs, log -> firstNonBlank(log.source(), DEFAULT_CATEGORY));
    }

    public Map<String, Long> topCategories(Collection<LogEntryResponse> logs) {
        return topN(logs, log -> firstNonBlank(log.category(), firstNonBlank(log.source(), DEFAULT_CATEGORY)));
    }

    private Map<String, Long> topN(Collection<LogEntryResponse> logs, Function<LogEntryResponse, String> key) {
        Map<String, Long> counts = new HashMap<>();
        logs.forEach(log -> counts.merge(key.apply(log), 1L, Long::sum));

        Map<String, Long> ranked = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(topN)
                .forEach(entry -> ranked.put(entry.getKey(), entry.getValue()));
        return ranked;
    }

    /**
     * Scores each level's hourly counts between {@code from} and {@code to} (clock hours,
     * both ends included, empty hours counted as zero) and returns the flagged buckets ordered
     * by hour, then level.
     */
    public List<AnomalyFlag> anomalies(Collection<LogEntryResponse> logs, Instant from, Instant to) {
        Instant firstHour = from.truncatedTo(ChronoUnit.HOURS);
        int hours = (int) ChronoUnit.HOURS.between(firstHour, to.truncatedTo(ChronoUnit.HOURS)) + 1;

        Map<String, long[]> seriesByLevel = new LinkedHashMap<>();
        for (String level : new TreeSet<>(logs.stream()
                .map(log -> log.level() == null ? OTHER_LEVEL : log.level().toLowerCase(Locale.ROOT))
                .toList())) {
            seriesByLevel.put(level, new long[hours]);
        }

        for (LogEntryResponse log : logs) {
            if (log.timestamp() == null) {
                continue;
            }
            int index = (int) ChronoUnit.HOURS.between(firstHour, log.timestamp().truncatedTo(ChronoUnit.HOURS));
            if (index >= 0 && index < hours) {
                String level = log.level() == null ? OTHER_LEVEL : log.level().toLowerCase(Locale.ROOT);
                seriesByLevel.get(level)[index]++;
            }
        }

        List<AnomalyFlag> flags = new ArrayList<>();
        seriesByLevel.forEach((level, series) -> {
            List<Long> counts = new ArrayList<>(series.length);
            for (long count : series) {
                counts.add(count);
            }
            anomalyDetector.score(counts).stream()
                    .filter(BucketScore::flagged)
                    .map(score -> new AnomalyFlag(
                            firstHour.plus(score.index(), ChronoUnit.HOURS),
                            level,
                            score.count(),
                            score.mean(),
                            score.stdDev(),
                            score.zScore(),
                            score.severity()))
                    .forEach(flags::add);
        });

        flags.sort(Comparator.comparing(AnomalyFlag::hour).thenComparing(AnomalyFlag::level));
        return flags;
    }

    public AnalyticsResponse analytics(Collection<LogEntryResponse> logs, long periodHours) {
        long totalLogs = logs.size();
        long errorLogs = logs.stream()
                .filter(log -> LogLevel.fromValue(log.level()).map(LogLevel::isProblem).orElse(false))
                .count();
        long activeSources = logs.stream()
                .map(LogEntryResponse::source)
                .filter(source -> source != null && !source.isBlank())
                .distinct()
                .count();

        Map<String, Long> levels = levelDistribution(logs);
        Map<String, Long> categories = topCategories(logs);

        return new AnalyticsResponse(
                true,
                totalLogs,
                errorLogs,
                Math.round((double) totalLogs / Math.max(1, periodHours)),
                activeSources,
                hourly(logs),
                new ChartData(new ArrayList<>(levels.keySet()), new ArrayList<>(levels.values())),
                new ChartData(new ArrayList<>(categories.keySet()), new ArrayList<>(categories.values()))
        );
    }

    private static String firstNonBlank(String value, String fallback) {
        return value == null || value.isBlank() ? Objects.requireNonNull(fallback) : value;
    }
}
