package com.example.logmanager.kafka;

import com.example.logmanager.logs.DTOs.LogEntryRequest;
import com.example.logmanager.logs.DTOs.LogEntryResponse;
import com.example.logmanager.logs.services.LogIngestService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Batch listener for queued log entries. A batch that fails as a whole is retried record by
 * record so that only the entries that fail on their own reach the dead letter topic.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "logs.ingest.kafka.enabled", havingValue = "true")
public class LogConsumer {

    private final LogIngestService logIngestService;
    private final KafkaErrorHandler kafkaErrorHandler;

    public LogConsumer(LogIngestService logIngestService, KafkaErrorHandler kafkaErrorHandler) {
        this.logIngestService = logIngestService;
        this.kafkaErrorHandler = kafkaErrorHandler;
    }

    @KafkaListener(topics = "${logs.ingest.kafka.topic:logs}", groupId = "log-processor-group")
    public void consumeLogBatch(
            List<LogEntryRequest> requests,
            @Header(KafkaHeaders.RECEIVED_PARTITION) List<Integer> partitions,
            @Header(KafkaHeaders.OFFSET) List<Long> offsets) {
        long startTime = System.nanoTime();

        try {
            List<LogEntryResponse> saved = logIngestService.persistBatch(requests);
            log.info("Stored {} queued logs from partition(s) {} in {}ms",
                    saved.size(), partitions.stream().distinct().toList(),
                    (System.nanoTime() - startTime) / 1_000_000);
        } catch (Exception e) {
            log.warn("Batch of {} logs failed ({}), retrying one by one", requests.size(), e.getMessage());
            persistIndividually(requests, partitions, offsets);
        }
    }

    private void persistIndividually(List<LogEntryRequest> requests, List<Integer> partitions, List<Long> offsets) {
        int failed = 0;
        for (int i = 0; i < requests.size(); i++) {
            LogEntryRequest request = requests.get(i);
            try {
                logIngestService.persistBatch(List.of(request));
            } catch (Exception e) {
                failed++;
                kafkaErrorHandler.sendToDLQ(request, e, partitions.get(i), offsets.get(i));
            }
        }
        if (failed > 0) {
            log.error("{} of {} logs sent to the dead letter topic", failed, requests.size());
        }
    }
}
