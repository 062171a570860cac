package com.example.logmanager.logs.services;

import com.example.logmanager.config.LogManagerProperties;
import com.example.logmanager.logs.DTOs.AppliedQuery;
import com.example.logmanager.logs.DTOs.LogEntryResponse;
import com.example.logmanager.logs.DTOs.LogFilterRequest;
import com.example.logmanager.logs.DTOs.LogPageResponse;
import com.example.logmanager.logs.query.CompiledQuery;
import com.example.logmanager.logs.query.LogQueryParser;
import com.example.logmanager.logs.store.LogRowMapper;
import com.example.logmanager.logs.store.LogStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds and runs the filtered, paginated log queries behind the list, count and export
 * endpoints.
 *
 * <p>A structured {@code q} that passes {@link LogQueryParser#isValid(String)} replaces every
 * discrete filter. A rejected {@code q} is ignored and the discrete filters apply instead.
 */
@Slf4j
@Service
public class LogQueryService {

    static final String SELECT_LOGS = "SELECT " + LogRowMapper.COLUMNS + " FROM logs WHERE ";
    static final String COUNT_LOGS = "SELECT COUNT(*) AS count FROM logs WHERE ";
    static final String ORDER_AND_PAGE = " ORDER BY timestamp DESC LIMIT :limit OFFSET :offset";

    private final LogStore logStore;
    private final LogRowMapper logRowMapper;
    private final LogQueryParser queryParser;
    private final QueryMetrics queryMetrics;
    private final LogManagerProperties properties;
    private final Clock clock;

    public LogQueryService(
            LogStore logStore,
            LogRowMapper logRowMapper,
            LogQueryParser queryParser,
            QueryMetrics queryMetrics,
            LogManagerProperties properties,
            Clock clock) {
        this.logStore = logStore;
        this.logRowMapper = logRowMapper;
        this.queryParser = queryParser;
        this.queryMetrics = queryMetrics;
        this.properties = properties;
        this.clock = clock;
    }

    public LogPageResponse search(LogFilterRequest filter) {
        long startTime = System.nanoTime();

        Pagination pagination = resolvePagination(filter);
        FilterPredicate predicate = buildPredicate(filter);

        Map<String, Object> pageParams = new LinkedHashMap<>(predicate.params());
        pageParams.put("limit", pagination.limit());
        pageParams.put("offset", pagination.offset());

        List<LogEntryResponse> logs = logStore.query(
                SELECT_LOGS + predicate.where() + ORDER_AND_PAGE, pageParams, logRowMapper);
        long total = logStore.count(COUNT_LOGS + predicate.where(), predicate.params());

        queryMetrics.recordSearch(startTime);
        log.debug("Search completed: mode={}, {} of {} logs, limit={}, offset={}",
                predicate.applied().mode(), logs.size(), total, pagination.limit(), pagination.offset());

        int page = filter.page() != null && filter.page() > 0 ? filter.page() : pagination.page();
        return new LogPageResponse(
                true,
                logs,
                total,
                pagination.limit(),
                pagination.offset(),
                page,
                pagination.limit(),
                predicate.applied()
        );
    }

    public List<LogEntryResponse> export(LogFilterRequest filter) {
        FilterPredicate predicate = buildPredicate(filter);
        Map<String, Object> params = new LinkedHashMap<>(predicate.params());
        params.put("limit", properties.getQuery().getExportLimit());
        params.put("offset", 0);
        return logStore.query(SELECT_LOGS + predicate.where() + ORDER_AND_PAGE, params, logRowMapper);
    }

    public List<LogEntryResponse> latest(String since) {
        return logStore.query(
                SELECT_LOGS + "timestamp > :since ORDER BY timestamp DESC LIMIT :limit",
                Map.of("since", since, "limit", properties.getQuery().getLatestLimit()),
                logRowMapper);
    }

    public long count(String level, String source) {
        StringBuilder where = new StringBuilder("1=1");
        Map<String, Object> params = new LinkedHashMap<>();
        if (hasText(level)) {
            where.append(" AND level = :level");
            params.put("level", level);
        }
        if (hasText(source)) {
            where.append(" AND source = :source");
            params.put("source", source);
        }
        return logStore.count(COUNT_LOGS + where, params);
    }

    public long countToday() {
        ZoneId zone = properties.getAnalytics().getZone();
        LocalDate today = LocalDate.now(clock.withZone(zone));
        return logStore.count(
                COUNT_LOGS + "timestamp >= :dayStart AND timestamp < :dayEnd",
                Map.of(
                        "dayStart", Timestamp.from(today.atStartOfDay(zone).toInstant()),
                        "dayEnd", Timestamp.from(today.plusDays(1).atStartOfDay(zone).toInstant())));
    }

    /**
     * Resolves the effective window: {@code page}/{@code pageSize} win when both are positive,
     * otherwise {@code limit}/{@code offset} with their defaults.
     */
    public Pagination resolvePagination(LogFilterRequest filter) {
        LogManagerProperties.Query settings = properties.getQuery();

        if (isPositive(filter.page()) && isPositive(filter.pageSize())) {
            int pageSize = Math.min(filter.pageSize(), settings.getMaxLimit());
            long offset = (long) (filter.page() - 1) * pageSize;
            if (offset > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("page out of range");
            }
            return new Pagination(pageSize, (int) offset);
        }

        int limit = filter.limit() != null && filter.limit() > 0 && filter.limit() <= settings.getMaxLimit()
                ? filter.limit()
                : settings.getDefaultLimit();
        int offset = filter.offset() != null && filter.offset() >= 0 ? filter.offset() : 0;
        return new Pagination(limit, offset);
    }

    public FilterPredicate buildPredicate(LogFilterRequest filter) {
        if (filter.hasQuery()) {
            if (queryParser.isValid(filter.q())) {
                CompiledQuery compiled = queryParser.parse(filter.q());
                queryMetrics.recordStructured();
                return new FilterPredicate(
                        "1=1 AND (" + compiled.where() + ")",
                        compiled.params(),
                        new AppliedQuery(filter.q(), AppliedQuery.STRUCTURED, compiled.where()));
            }
            queryMetrics.recordRejected();
            log.warn("Rejected suspicious query, using discrete filters instead: q={}", filter.q());
        }

        queryMetrics.recordLegacy();
        return buildLegacyPredicate(filter);
    }

    private FilterPredicate buildLegacyPredicate(LogFilterRequest filter) {
        StringBuilder where = new StringBuilder("1=1");
        Map<String, Object> params = new LinkedHashMap<>();

        if (hasText(filter.level())) {
            where.append(" AND level = :level");
            params.put("level", filter.level());
        }
        if (hasText(filter.source())) {
            where.append(" AND source = :source");
            params.put("source", filter.source());
        }
        if (hasText(filter.search())) {
            where.append(" AND (message LIKE :search OR source LIKE :search)");
            params.put("search", "%" + filter.search() + "%");
        }
        if (hasText(filter.startDate())) {
            where.append(" AND timestamp >= :startDate");
            params.put("startDate", filter.startDate());
        }
        if (hasText(filter.endDate())) {
            where.append(" AND timestamp <= :endDate");
            params.put("endDate", filter.endDate());
        }
        if (hasText(filter.category())) {
            // category is the historical name of the source filter
            where.append(" AND source = :category");
            params.put("category", filter.category());
        }

        return new FilterPredicate(where.toString(), params,
                new AppliedQuery(filter.q(), AppliedQuery.LEGACY, where.toString()));
    }

    private static boolean isPositive(Integer value) {
        return value != null && value > 0;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
