package com.example.logmanager.redis;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.Cache;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Counts and logs Redis cache failures. A failing cache never fails the request: a broken
 * GET is treated as a miss and the stats are computed from the database.
 *
 * <p>Hit/miss ratios come from the {@code cache.gets} meters Spring Boot binds for the
 * cache manager; this class only adds {@code cache.errors.total}, tagged by operation.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "spring.cache.type", havingValue = "redis")
public class RedisCacheMetrics implements CacheErrorHandler {

    private final MeterRegistry meterRegistry;

    public RedisCacheMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public double errorCount() {
        return meterRegistry.find("cache.errors.total").counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    @Override
    public void handleCacheGetError(RuntimeException exception, Cache cache, Object key) {
        record("get", cache, key, exception);
    }

    @Override
    public void handleCachePutError(RuntimeException exception, Cache cache, Object key, @Nullable Object value) {
        record("put", cache, key, exception);
    }

    @Override
    public void handleCacheEvictError(RuntimeException exception, Cache cache, Object key) {
        record("evict", cache, key, exception);
    }

    @Override
    public void handleCacheClearError(RuntimeException exception, Cache cache) {
        record("clear", cache, null, exception);
    }

    private void record(String operation, Cache cache, @Nullable Object key, RuntimeException exception) {
        Counter.builder("cache.errors.total")
                .description("Total number of cache operation errors")
                .tag("cache", cache.getName())
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
        log.error("Cache {} failed in cache={} key={}: {}",
                operation.toUpperCase(Locale.ROOT), cache.getName(), key, exception.getMessage());
    }
}
