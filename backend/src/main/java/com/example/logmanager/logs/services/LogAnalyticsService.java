package com.example.logmanager.logs.services;

import com.example.logmanager.logs.DTOs.AnalyticsResponse;
import com.example.logmanager.logs.DTOs.AnomalyResponse;
import com.example.logmanager.logs.DTOs.LogEntryResponse;
import com.example.logmanager.logs.DTOs.StatsResponse;
import com.example.logmanager.logs.analytics.LogAnalyticsAggregator;
import com.example.logmanager.logs.analytics.StatsGrouping;
import com.example.logmanager.logs.analytics.StatsPeriod;
import com.example.logmanager.logs.store.LogRowMapper;
import com.example.logmanager.logs.store.LogStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Chart data for the dashboard. Results are cached briefly since every dashboard refresh asks
 * for the same windows.
 */
@Slf4j
@Service
public class LogAnalyticsService {

    public static final String CACHE_NAME = "log-stats";

    private static final String SELECT_WINDOW = "SELECT " + LogRowMapper.COLUMNS
            + " FROM logs WHERE timestamp >= :since ORDER BY timestamp DESC";

    private final LogStore logStore;
    private final LogRowMapper logRowMapper;
    private final LogAnalyticsAggregator aggregator;
    private final Clock clock;

    public LogAnalyticsService(
            LogStore logStore,
            LogRowMapper logRowMapper,
            LogAnalyticsAggregator aggregator,
            Clock clock) {
        this.logStore = logStore;
        this.logRowMapper = logRowMapper;
        this.aggregator = aggregator;
        this.clock = clock;
    }

    @Cacheable(cacheNames = CACHE_NAME, key = "'stats:' + #period + ':' + #groupBy")
    public StatsResponse stats(String period, String groupBy) {
        StatsPeriod statsPeriod = StatsPeriod.fromValue(period);
        StatsGrouping grouping = StatsGrouping.fromValue(groupBy);

        Instant now = clock.instant();
        Instant since = now.minus(statsPeriod.window());
        List<LogEntryResponse> logs = fetchSince(since);
        log.debug("Computing stats: period={}, groupBy={}, rows={}", period, groupBy, logs.size());

        return switch (grouping) {
            case HOUR -> StatsResponse.series(period, groupBy, aggregator.hourly(logs));
            case DAY -> StatsResponse.series(period, groupBy, aggregator.daily(logs, since, now));
            case LEVEL -> StatsResponse.byLevel(period, aggregator.levelDistribution(logs), logs.size());
            case SOURCE -> StatsResponse.bySource(period, aggregator.topSources(logs), logs.size());
        };
    }

    @Cacheable(cacheNames = CACHE_NAME, key = "'analytics:' + #period")
    public AnalyticsResponse analytics(String period) {
        StatsPeriod statsPeriod = StatsPeriod.fromValue(period);
        List<LogEntryResponse> logs = fetchSince(clock.instant().minus(statsPeriod.window()));
        return aggregator.analytics(logs, statsPeriod.hours());
    }

    @Cacheable(cacheNames = CACHE_NAME, key = "'anomalies:' + #period")
    public AnomalyResponse anomalies(String period) {
        StatsPeriod statsPeriod = StatsPeriod.fromValue(period);
        Instant now = clock.instant();
        Instant since = now.minus(statsPeriod.window());

        AnomalyResponse response = new AnomalyResponse(true, period,
                aggregator.anomalies(fetchSince(since), since, now));
        if (!response.anomalies().isEmpty()) {
            log.info("Detected {} anomalous hour/level bucket(s) over {}", response.anomalies().size(), period);
        }
        return response;
    }

    private List<LogEntryResponse> fetchSince(Instant since) {
        return logStore.query(SELECT_WINDOW, Map.of("since", Timestamp.from(since)), logRowMapper);
    }
}
