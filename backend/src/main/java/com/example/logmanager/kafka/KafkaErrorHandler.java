package com.example.logmanager.kafka;

import com.example.logmanager.config.LogManagerProperties;
import com.example.logmanager.logs.DTOs.LogEntryRequest;
import com.example.logmanager.logs.services.IngestMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Routes logs that could not be persisted to the dead letter topic, recording the failure
 * and the original coordinates in the log's metadata.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "logs.ingest.kafka.enabled", havingValue = "true")
public class KafkaErrorHandler {

    private final KafkaTemplate<String, LogEntryRequest> kafkaTemplate;
    private final IngestMetrics ingestMetrics;
    private final Clock clock;
    private final String dlqTopic;

    public KafkaErrorHandler(
            KafkaTemplate<String, LogEntryRequest> kafkaTemplate,
            IngestMetrics ingestMetrics,
            LogManagerProperties properties,
            Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.ingestMetrics = ingestMetrics;
        this.clock = clock;
        this.dlqTopic = properties.getIngest().getKafka().getDlqTopic();
    }

    public void sendToDLQ(
            LogEntryRequest request,
            Exception error,
            int partition,
            long offset) {

        log.error("Sending to DLQ: source={}, partition={}, offset={}, error={}",
                request.source(), partition, offset, error.getMessage());

        LogEntryRequest enrichedRequest = withFailureMetadata(request, error, partition, offset);
        ingestMetrics.recordFailed();

        try {
            kafkaTemplate.send(dlqTopic, request.source(), enrichedRequest)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("CRITICAL: Failed to send to DLQ! Data may be lost. " +
                                    "source={}, error={}", request.source(), ex.getMessage());
                        }
                    });
        } catch (Exception e) {
            log.error("CRITICAL: DLQ send threw exception! source={}, error={}",
                    request.source(), e.getMessage());
        }
    }

    LogEntryRequest withFailureMetadata(LogEntryRequest request, Exception error, int partition, long offset) {
        Map<String, Object> metadata = new HashMap<>(
                request.metadata() != null ? request.metadata() : Map.of()
        );
        metadata.put("dlq-timestamp", clock.instant().toString());
        metadata.put("dlq-error", String.valueOf(error.getMessage()));
        metadata.put("dlq-error-code", error.getClass().getName());
        metadata.put("dlq-original-partition", partition);
        metadata.put("dlq-original-offset", offset);

        return new LogEntryRequest(
                request.level(),
                request.message(),
                request.source(),
                request.timestamp(),
                request.category(),
                metadata,
                request.ip()
        );
    }
}
