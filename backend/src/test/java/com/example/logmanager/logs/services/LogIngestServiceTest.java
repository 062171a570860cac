package com.example.logmanager.logs.services;

import com.example.logmanager.logs.DTOs.LogDeletedEvent;
import com.example.logmanager.logs.DTOs.LogEntryRequest;
import com.example.logmanager.logs.DTOs.LogEntryResponse;
import com.example.logmanager.logs.LogNotFoundException;
import com.example.logmanager.logs.LogRepository;
import com.example.logmanager.logs.models.LogEntry;
import com.example.logmanager.logs.query.ConditionBuilder;
import com.example.logmanager.logs.query.LogQueryParser;
import com.example.logmanager.logs.query.QueryTokenizer;
import com.example.logmanager.logs.store.ExecutionResult;
import com.example.logmanager.logs.store.LogStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LogIngestServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");

    @Mock
    private LogRepository logRepository;
    @Mock
    private LogStore logStore;
    @Mock
    private LogEventPublisher eventPublisher;
    @Mock
    private ObjectProvider<LogEntryQueue> queueProvider;
    @Mock
    private LogEntryQueue logEntryQueue;
    @Captor
    private ArgumentCaptor<List<LogEntry>> entitiesCaptor;
    @Captor
    private ArgumentCaptor<LogDeletedEvent> deletedCaptor;
    @Captor
    private ArgumentCaptor<List<LogEntryResponse>> publishedCaptor;

    private MeterRegistry meterRegistry;
    private LogIngestService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new LogIngestService(
                logRepository,
                logStore,
                new LogQueryParser(new QueryTokenizer(), new ConditionBuilder(), new QueryMetrics(meterRegistry)),
                eventPublisher,
                queueProvider,
                new IngestMetrics(meterRegistry),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldPersistWithDefaultsWhenNoQueueIsConfigured() {
        stubSaveAllAssigningIds();

        IngestResult result = service.ingest(request(null, "User logged in", null), "10.0.0.7");

        assertThat(result).isEqualTo(new IngestResult(1L, false));
        verify(logRepository).saveAll(entitiesCaptor.capture());
        LogEntry saved = entitiesCaptor.getValue().get(0);
        assertThat(saved.getLevel()).isEqualTo("info");
        assertThat(saved.getSource()).isEqualTo("api");
        assertThat(saved.getTimestamp()).isEqualTo(NOW);
        assertThat(saved.getIp()).isEqualTo("10.0.0.7");
        assertThat(saved.getCreatedAt()).isEqualTo(NOW);
        assertThat(meterRegistry.counter("logs.stored.total").count()).isEqualTo(1.0);
    }

    @Test
    void shouldAnnounceCreatedLogs() {
        stubSaveAllAssigningIds();

        service.ingestBatch(List.of(
                request("error", "first", "auth"),
                request("warning", "second", "auth")), "10.0.0.7");

        verify(eventPublisher).publishCreated(publishedCaptor.capture());
        assertThat(publishedCaptor.getValue()).extracting(LogEntryResponse::message).containsExactly("first", "second");
        assertThat(publishedCaptor.getValue()).extracting(LogEntryResponse::id).containsExactly(1L, 2L);
    }

    @Test
    void shouldHandOffToQueueWhenConfigured() {
        when(queueProvider.getIfAvailable()).thenReturn(logEntryQueue);

        IngestResult result = service.ingest(request("error", "Disk full", "storage"), "10.0.0.7");

        assertThat(result.queued()).isTrue();
        assertThat(result.id()).isNull();
        ArgumentCaptor<LogEntryRequest> queued = ArgumentCaptor.forClass(LogEntryRequest.class);
        verify(logEntryQueue).enqueueLogEntry(queued.capture());
        assertThat(queued.getValue().timestamp()).isEqualTo(NOW);
        assertThat(queued.getValue().ip()).isEqualTo("10.0.0.7");
        verify(logRepository, never()).saveAll(anyList());
        assertThat(meterRegistry.counter("logs.queued.total").count()).isEqualTo(1.0);
    }

    @Test
    void shouldQueueEveryEntryOfBatch() {
        when(queueProvider.getIfAvailable()).thenReturn(logEntryQueue);

        List<IngestResult> results = service.ingestBatch(List.of(
                request("info", "a", null),
                request("info", "b", null),
                request("info", "c", null)), null);

        assertThat(results).hasSize(3).allMatch(IngestResult::queued);
        verify(logEntryQueue, times(3)).enqueueLogEntry(any());
    }

    @Test
    void shouldRejectUnknownLevel() {
        assertThatThrownBy(() -> service.ingest(request("fatal", "x", null), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("invalid level");
        verifyNoInteractions(logRepository);
    }

    @Test
    void shouldRejectNullByteInMessage() {
        assertThatThrownBy(() -> service.ingest(request("info", "bad\u0000message", null), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("message contains invalid null byte");
    }

    @Test
    void shouldRejectMissingMessage() {
        assertThatThrownBy(() -> service.ingest(request("info", " ", null), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("message is required");
    }

    @Test
    void shouldThrowNotFoundForMissingLog() {
        when(logRepository.findById(42L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.findById(42L))
                .isInstanceOf(LogNotFoundException.class)
                .hasMessageContaining("42");
    }

    @Test
    void shouldDeleteExistingLogAndAnnounceIt() {
        when(logRepository.existsById(5L)).thenReturn(true);

        service.delete(5L);

        verify(logRepository).deleteById(5L);
        verify(eventPublisher).publishDeleted(deletedCaptor.capture());
        assertThat(deletedCaptor.getValue()).isEqualTo(new LogDeletedEvent(5L, null, 1));
    }

    @Test
    void shouldNotDeleteMissingLog() {
        when(logRepository.existsById(5L)).thenReturn(false);

        assertThatThrownBy(() -> service.delete(5L)).isInstanceOf(LogNotFoundException.class);
        verify(logRepository, never()).deleteById(any());
    }

    @Test
    void shouldBulkDeleteThroughCompiledQuery() {
        when(logStore.execute(anyString(), anyMap())).thenReturn(new ExecutionResult(3, null));

        int deleted = service.deleteMatching("level:debug AND source:healthcheck");

        assertThat(deleted).isEqualTo(3);
        verify(logStore).execute(
                eq("DELETE FROM logs WHERE level = :param0 AND source = :param1"),
                eq(Map.of("param0", "debug", "param1", "healthcheck")));
        verify(eventPublisher).publishDeleted(new LogDeletedEvent(null, "level:debug AND source:healthcheck", 3));
    }

    @Test
    void shouldRefuseBulkDeleteWithoutRestrictingQuery() {
        assertThatThrownBy(() -> service.deleteMatching(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.deleteMatching("level:error; DROP TABLE logs"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.deleteMatching("host:web-1"))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(logStore);
    }

    private void stubSaveAllAssigningIds() {
        AtomicLong ids = new AtomicLong();
        when(logRepository.saveAll(anyList())).thenAnswer(invocation -> {
            List<LogEntry> entities = invocation.getArgument(0);
            List<LogEntry> saved = new ArrayList<>();
            for (LogEntry entity : entities) {
                entity.setId(ids.incrementAndGet());
                saved.add(entity);
            }
            return saved;
        });
    }

    private static LogEntryRequest request(String level, String message, String source) {
        return new LogEntryRequest(level, message, source, null, null, Map.of("k", "v"), null);
    }
}
