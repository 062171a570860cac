package com.example.logmanager.kafka;

import com.example.logmanager.logs.DTOs.LogEntryRequest;
import com.example.logmanager.logs.services.LogIngestService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LogConsumerTest {

    @Mock
    private LogIngestService logIngestService;
    @Mock
    private KafkaErrorHandler kafkaErrorHandler;
    @InjectMocks
    private LogConsumer logConsumer;

    private final List<LogEntryRequest> batch = List.of(
            new LogEntryRequest("info", "a", "api", null, null, null, null),
            new LogEntryRequest("info", "b", "api", null, null, null, null));

    @Test
    void shouldPersistWholeBatch() {
        when(logIngestService.persistBatch(batch)).thenReturn(List.of());

        logConsumer.consumeLogBatch(batch, List.of(0, 0), List.of(10L, 11L));

        verify(logIngestService).persistBatch(batch);
        verifyNoInteractions(kafkaErrorHandler);
    }

    @Test
    void shouldRetryRecordsIndividuallyWhenBatchFails() {
        when(logIngestService.persistBatch(batch)).thenThrow(new DataAccessResourceFailureException("constraint"));
        when(logIngestService.persistBatch(List.of(batch.get(0)))).thenReturn(List.of());
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("bad row");
        when(logIngestService.persistBatch(List.of(batch.get(1)))).thenThrow(failure);

        logConsumer.consumeLogBatch(batch, List.of(1, 1), List.of(20L, 21L));

        verify(kafkaErrorHandler).sendToDLQ(batch.get(1), failure, 1, 21L);
        verify(kafkaErrorHandler, times(1)).sendToDLQ(any(), any(), anyInt(), anyLong());
    }

    @Test
    void shouldRouteEveryRecordToDeadLetterTopicWhenDatabaseIsDown() {
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("db down");
        when(logIngestService.persistBatch(anyList())).thenThrow(failure);

        logConsumer.consumeLogBatch(batch, List.of(1, 1), List.of(20L, 21L));

        verify(kafkaErrorHandler).sendToDLQ(batch.get(0), failure, 1, 20L);
        verify(kafkaErrorHandler).sendToDLQ(batch.get(1), failure, 1, 21L);
        verify(kafkaErrorHandler, times(2)).sendToDLQ(any(), any(), anyInt(), anyLong());
    }
}
