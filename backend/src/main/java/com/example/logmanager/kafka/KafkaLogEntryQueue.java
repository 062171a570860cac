package com.example.logmanager.kafka;

import com.example.logmanager.config.LogManagerProperties;
import com.example.logmanager.logs.DTOs.LogEntryRequest;
import com.example.logmanager.logs.services.LogEntryQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Hands accepted logs to Kafka, keyed by source so one source's logs stay ordered within a
 * partition. {@link LogConsumer} persists them in batches.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "logs.ingest.kafka.enabled", havingValue = "true")
public class KafkaLogEntryQueue implements LogEntryQueue {

    private final KafkaTemplate<String, LogEntryRequest> kafkaTemplate;
    private final String topic;

    public KafkaLogEntryQueue(KafkaTemplate<String, LogEntryRequest> kafkaTemplate, LogManagerProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = properties.getIngest().getKafka().getTopic();
    }

    @Override
    public void enqueueLogEntry(LogEntryRequest request) {
        CompletableFuture<SendResult<String, LogEntryRequest>> future =
                kafkaTemplate.send(topic, request.source(), request);

        future.whenComplete((result, e) -> {
            if (e != null) {
                log.error("Failed to send log to Kafka: source={}, level={}, error={}",
                        request.source(), request.level(), e.getMessage());
            } else {
                log.trace("Queued log: partition={}, offset={}",
                        result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            }
        });
    }
}
