package com.example.logmanager.redis;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.cache.concurrent.ConcurrentMapCache;

import static org.assertj.core.api.Assertions.assertThat;

class RedisCacheMetricsTest {

    @Test
    void shouldCountEveryKindOfCacheFailure() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        RedisCacheMetrics metrics = new RedisCacheMetrics(meterRegistry);
        ConcurrentMapCache cache = new ConcurrentMapCache("log-stats");
        RuntimeException failure = new IllegalStateException("connection reset");

        metrics.handleCacheGetError(failure, cache, "stats:24h:hour");
        metrics.handleCacheGetError(failure, cache, "stats:7d:day");
        metrics.handleCachePutError(failure, cache, "stats:24h:hour", null);
        metrics.handleCacheEvictError(failure, cache, "stats:24h:hour");
        metrics.handleCacheClearError(failure, cache);

        assertThat(metrics.errorCount()).isEqualTo(5.0);
        assertThat(meterRegistry.get("cache.errors.total")
                .tag("cache", "log-stats").tag("operation", "get").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("cache.errors.total")
                .tag("operation", "clear").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldReportZeroBeforeAnyFailure() {
        assertThat(new RedisCacheMetrics(new SimpleMeterRegistry()).errorCount()).isZero();
    }
}
