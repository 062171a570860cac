package com.example.logmanager.logs.services;

import com.example.logmanager.config.LogManagerProperties;
import com.example.logmanager.logs.DTOs.LogDeletedEvent;
import com.example.logmanager.logs.DTOs.LogEntryResponse;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * STOMP implementation of {@link LogEventPublisher}.
 *
 * <p>Created logs are queued and flushed to {@value #CREATED_TOPIC} in batches on a fixed
 * interval; when the queue is full the oldest entries are dropped. Deletions are sent
 * immediately to {@value #DELETED_TOPIC}.
 */
@Slf4j
@Service
public class WebsocketService implements LogEventPublisher {

    public static final String CREATED_TOPIC = "/topic/logs-batch";
    public static final String DELETED_TOPIC = "/topic/logs-deleted";

    private final SimpMessagingTemplate messagingTemplate;
    private final LogManagerProperties.Broadcast settings;
    private final BlockingDeque<LogEntryResponse> pending;

    private final Counter queuedCounter;
    private final Counter sentCounter;
    private final Counter droppedCounter;

    private ScheduledExecutorService flusher;

    public WebsocketService(SimpMessagingTemplate messagingTemplate,
                            LogManagerProperties properties,
                            MeterRegistry meterRegistry) {
        this.messagingTemplate = messagingTemplate;
        this.settings = properties.getBroadcast();
        this.pending = new LinkedBlockingDeque<>(settings.getQueueCapacity());

        this.queuedCounter = Counter.builder("logs.broadcast.queued.total")
                .description("Created logs queued for websocket broadcast")
                .register(meterRegistry);
        this.sentCounter = Counter.builder("logs.broadcast.sent.total")
                .description("Created logs delivered to websocket subscribers")
                .register(meterRegistry);
        this.droppedCounter = Counter.builder("logs.broadcast.dropped.total")
                .description("Created logs dropped because the broadcast queue was full")
                .register(meterRegistry);
        Gauge.builder("logs.broadcast.pending", pending, BlockingDeque::size)
                .description("Created logs waiting for the next flush")
                .register(meterRegistry);
    }

    @PostConstruct
    public void start() {
        if (!settings.isEnabled()) {
            log.info("Live websocket updates disabled");
            return;
        }
        flusher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "log-broadcast");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = settings.getInterval().toMillis();
        flusher.scheduleAtFixedRate(this::flushPendingLogs, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        log.info("Websocket broadcast every {}ms, up to {} logs per message, {} queued at most",
                intervalMs, settings.getBatchSize(), settings.getQueueCapacity());
    }

    @PreDestroy
    public void stop() {
        if (flusher == null) {
            return;
        }
        flusher.shutdown();
        try {
            flusher.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void publishCreated(List<LogEntryResponse> logs) {
        if (!settings.isEnabled() || logs == null || logs.isEmpty()) {
            return;
        }

        int dropped = 0;
        for (LogEntryResponse entry : logs) {
            while (!pending.offerLast(entry)) {
                if (pending.pollFirst() != null) {
                    dropped++;
                }
            }
        }
        queuedCounter.increment(logs.size());

        if (dropped > 0) {
            droppedCounter.increment(dropped);
            log.warn("Broadcast queue full, dropped {} oldest logs", dropped);
        }
    }

    @Override
    public void publishDeleted(LogDeletedEvent event) {
        if (!settings.isEnabled()) {
            return;
        }
        try {
            messagingTemplate.convertAndSend(DELETED_TOPIC, event);
        } catch (Exception e) {
            log.error("Delete notification failed: {}", e.getMessage());
        }
    }

    public BroadcastStats getStats() {
        return new BroadcastStats(
                (long) queuedCounter.count(),
                (long) sentCounter.count(),
                (long) droppedCounter.count(),
                pending.size(),
                settings.isEnabled()
        );
    }

    void flushPendingLogs() {
        List<LogEntryResponse> batch = new ArrayList<>();
        pending.drainTo(batch, settings.getBatchSize());
        if (batch.isEmpty()) {
            return;
        }

        try {
            messagingTemplate.convertAndSend(CREATED_TOPIC, batch);
            sentCounter.increment(batch.size());
            log.debug("Broadcast {} logs, {} still queued", batch.size(), pending.size());
        } catch (Exception e) {
            // not re-queued: a failing broker would otherwise loop on the same batch
            log.error("Websocket broadcast of {} logs failed: {}", batch.size(), e.getMessage());
        }
    }

    public record BroadcastStats(
            long totalQueued,
            long totalSent,
            long totalDropped,
            int currentQueueSize,
            boolean enabled
    ) {}
}
