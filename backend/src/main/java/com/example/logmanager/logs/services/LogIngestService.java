package com.example.logmanager.logs.services;

import com.example.logmanager.logs.DTOs.LogDeletedEvent;
import com.example.logmanager.logs.DTOs.LogEntryRequest;
import com.example.logmanager.logs.DTOs.LogEntryResponse;
import com.example.logmanager.logs.LogNotFoundException;
import com.example.logmanager.logs.LogRepository;
import com.example.logmanager.logs.models.LogEntry;
import com.example.logmanager.logs.models.LogLevel;
import com.example.logmanager.logs.query.CompiledQuery;
import com.example.logmanager.logs.query.LogQueryParser;
import com.example.logmanager.logs.store.ExecutionResult;
import com.example.logmanager.logs.store.LogStore;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Write side of the logs API: create, batch create and delete.
 *
 * <p>New logs are persisted inline unless a {@link LogEntryQueue} bean exists, in which case
 * they are handed to it and persisted later by the queue consumer through
 * {@link #persistBatch(List)}.
 */
@Slf4j
@Service
public class LogIngestService {

    private final LogRepository logRepository;
    private final LogStore logStore;
    private final LogQueryParser queryParser;
    private final LogEventPublisher eventPublisher;
    private final ObjectProvider<LogEntryQueue> logEntryQueue;
    private final IngestMetrics ingestMetrics;
    private final Clock clock;

    public LogIngestService(
            LogRepository logRepository,
            LogStore logStore,
            LogQueryParser queryParser,
            LogEventPublisher eventPublisher,
            ObjectProvider<LogEntryQueue> logEntryQueue,
            IngestMetrics ingestMetrics,
            Clock clock) {
        this.logRepository = logRepository;
        this.logStore = logStore;
        this.queryParser = queryParser;
        this.eventPublisher = eventPublisher;
        this.logEntryQueue = logEntryQueue;
        this.ingestMetrics = ingestMetrics;
        this.clock = clock;
    }

    public IngestResult ingest(LogEntryRequest request, String clientIp) {
        LogEntryRequest prepared = prepare(request, clientIp);

        LogEntryQueue queue = logEntryQueue.getIfAvailable();
        if (queue != null) {
            queue.enqueueLogEntry(prepared);
            ingestMetrics.recordQueued();
            return new IngestResult(null, true);
        }

        LogEntryResponse saved = persistBatch(List.of(prepared)).get(0);
        log.info("Ingested log: id={}, source={}, level={}", saved.id(), saved.source(), saved.level());
        return new IngestResult(saved.id(), false);
    }

    public List<IngestResult> ingestBatch(List<LogEntryRequest> requests, String clientIp) {
        List<LogEntryRequest> prepared = requests.stream()
                .map(request -> prepare(request, clientIp))
                .toList();

        LogEntryQueue queue = logEntryQueue.getIfAvailable();
        if (queue != null) {
            prepared.forEach(request -> {
                queue.enqueueLogEntry(request);
                ingestMetrics.recordQueued();
            });
            return prepared.stream().map(request -> new IngestResult(null, true)).toList();
        }

        return persistBatch(prepared).stream()
                .map(saved -> new IngestResult(saved.id(), false))
                .toList();
    }

    /**
     * Stores already prepared requests and announces them to live subscribers.
     */
    @Transactional
    public List<LogEntryResponse> persistBatch(List<LogEntryRequest> requests) {
        long startTime = System.nanoTime();
        Instant now = clock.instant();

        List<LogEntry> entities = requests.stream()
                .map(request -> toEntity(request, now))
                .toList();
        List<LogEntryResponse> saved = logRepository.saveAll(entities).stream()
                .map(LogIngestService::toResponse)
                .toList();

        ingestMetrics.recordStored(saved.size());
        ingestMetrics.recordBatchProcessingTime(startTime);
        eventPublisher.publishCreated(saved);
        return saved;
    }

    public LogEntryResponse findById(Long id) {
        return logRepository.findById(id)
                .map(LogIngestService::toResponse)
                .orElseThrow(() -> new LogNotFoundException(id));
    }

    public void delete(Long id) {
        if (!logRepository.existsById(id)) {
            throw new LogNotFoundException(id);
        }
        logRepository.deleteById(id);
        ingestMetrics.recordDeleted(1);
        eventPublisher.publishDeleted(new LogDeletedEvent(id, null, 1));
        log.info("Deleted log: id={}", id);
    }

    /**
     * Deletes every log matching a structured query. Unlike searching, there is no lenient
     * fallback: a missing, rejected or match-everything query is refused.
     */
    public int deleteMatching(String q) {
        if (q == null || q.isBlank()) {
            throw new IllegalArgumentException("q is required for bulk delete");
        }
        if (!queryParser.isValid(q)) {
            throw new IllegalArgumentException("Query rejected");
        }

        CompiledQuery compiled = queryParser.parse(q);
        if (compiled.isMatchAll()) {
            throw new IllegalArgumentException("Query does not restrict any field");
        }

        ExecutionResult result = logStore.execute("DELETE FROM logs WHERE " + compiled.where(), compiled.params());
        ingestMetrics.recordDeleted(result.affectedRows());
        eventPublisher.publishDeleted(new LogDeletedEvent(null, q, result.affectedRows()));
        log.info("Bulk deleted {} log(s) matching q={}", result.affectedRows(), q);
        return result.affectedRows();
    }

    private LogEntryRequest prepare(LogEntryRequest request, String clientIp) {
        if (request.message() == null || request.message().isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
        if (request.message().indexOf('\u0000') >= 0) {
            throw new IllegalArgumentException("message contains invalid null byte");
        }
        if (request.level() != null && !request.level().isBlank()
                && LogLevel.fromValue(request.level()).isEmpty()) {
            throw new IllegalArgumentException("invalid level");
        }
        return request.withDefaults(clientIp, clock.instant());
    }

    private static LogEntry toEntity(LogEntryRequest request, Instant now) {
        LogEntry logEntry = new LogEntry();
        logEntry.setTimestamp(request.timestamp() == null ? now : request.timestamp());
        logEntry.setLevel(request.level() == null ? LogEntryRequest.DEFAULT_LEVEL : request.level());
        logEntry.setSource(request.source() == null ? LogEntryRequest.DEFAULT_SOURCE : request.source());
        logEntry.setMessage(request.message());
        logEntry.setIp(request.ip());
        logEntry.setCategory(request.category());
        logEntry.setMetadata(request.metadata());
        logEntry.setCreatedAt(now);
        return logEntry;
    }

    static LogEntryResponse toResponse(LogEntry logEntry) {
        return new LogEntryResponse(
                logEntry.getId(),
                logEntry.getTimestamp(),
                logEntry.getLevel(),
                logEntry.getSource(),
                logEntry.getMessage(),
                logEntry.getIp(),
                logEntry.getCategory(),
                logEntry.getMetadata()
        );
    }
}
