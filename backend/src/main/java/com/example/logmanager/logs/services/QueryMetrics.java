package com.example.logmanager.logs.services;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class QueryMetrics {

    private final Counter structuredQueriesCounter;
    private final Counter legacyQueriesCounter;
    private final Counter rejectedQueriesCounter;
    private final Counter fallbackQueriesCounter;
    private final Timer compileDuration;
    private final Timer searchDuration;

    public QueryMetrics(MeterRegistry meterRegistry) {
        this.structuredQueriesCounter = Counter.builder("logs.query.structured.total")
                .description("Searches filtered through the query language")
                .register(meterRegistry);

        this.legacyQueriesCounter = Counter.builder("logs.query.legacy.total")
                .description("Searches filtered through discrete filter parameters")
                .register(meterRegistry);

        this.rejectedQueriesCounter = Counter.builder("logs.query.rejected.total")
                .description("Queries rejected by the injection screen")
                .register(meterRegistry);

        this.fallbackQueriesCounter = Counter.builder("logs.query.fallback.total")
                .description("Queries that failed to compile and fell back to a message search")
                .register(meterRegistry);

        this.compileDuration = Timer.builder("logs.query.compile.duration")
                .description("Time taken to compile a query into a WHERE clause")
                .register(meterRegistry);

        this.searchDuration = Timer.builder("logs.query.search.duration")
                .description("Time taken to run a filtered search and its count")
                .register(meterRegistry);
    }

    public void recordStructured() {
        structuredQueriesCounter.increment();
    }

    public void recordLegacy() {
        legacyQueriesCounter.increment();
    }

    public void recordRejected() {
        rejectedQueriesCounter.increment();
    }

    public void recordFallback() {
        fallbackQueriesCounter.increment();
    }

    public void recordCompile(long startTimeNanos) {
        compileDuration.record(System.nanoTime() - startTimeNanos, TimeUnit.NANOSECONDS);
    }

    public void recordSearch(long startTimeNanos) {
        searchDuration.record(System.nanoTime() - startTimeNanos, TimeUnit.NANOSECONDS);
    }
}
