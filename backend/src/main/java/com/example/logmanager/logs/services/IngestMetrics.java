package com.example.logmanager.logs.services;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class IngestMetrics {

    private final Counter logsStoredCounter;
    private final Counter logsQueuedCounter;
    private final Counter logsFailedCounter;
    private final Counter logsDeletedCounter;

    private final Timer batchProcessingTime;

    public IngestMetrics(MeterRegistry meterRegistry) {
        this.logsStoredCounter = Counter.builder("logs.stored.total")
                .description("Total number of logs written to the database")
                .register(meterRegistry);

        this.logsQueuedCounter = Counter.builder("logs.queued.total")
                .description("Total number of logs handed to the ingestion queue")
                .register(meterRegistry);

        this.logsFailedCounter = Counter.builder("logs.dlq.total")
                .description("Total number of logs sent to the dead letter queue")
                .register(meterRegistry);

        this.logsDeletedCounter = Counter.builder("logs.deleted.total")
                .description("Total number of logs deleted")
                .register(meterRegistry);

        this.batchProcessingTime = Timer.builder("logs.batch.processing.duration")
                .description("Time taken to persist a batch of logs")
                .register(meterRegistry);
    }

    public void recordStored(int count) {
        logsStoredCounter.increment(count);
    }

    public void recordQueued() {
        logsQueuedCounter.increment();
    }

    public void recordFailed() {
        logsFailedCounter.increment();
    }

    public void recordDeleted(int count) {
        logsDeletedCounter.increment(count);
    }

    public void recordBatchProcessingTime(long startTimeNanos) {
        batchProcessingTime.record(System.nanoTime() - startTimeNanos, TimeUnit.NANOSECONDS);
    }
}
