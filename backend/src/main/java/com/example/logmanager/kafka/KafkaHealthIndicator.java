package com.example.logmanager.kafka;

import com.example.logmanager.config.LogManagerProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.clients.admin.DescribeClusterResult;
import org.apache.kafka.clients.admin.ListTopicsOptions;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Reports the ingestion queue's broker under {@code /actuator/health}. The broker is DOWN when
 * it cannot be reached. Topics are created on first send, so their absence is only a detail.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "logs.ingest.kafka.enabled", havingValue = "true")
public class KafkaHealthIndicator implements HealthIndicator {

    private static final int TIMEOUT_MS = 500;

    private final KafkaAdmin kafkaAdmin;
    private final LogManagerProperties.Kafka settings;

    public KafkaHealthIndicator(KafkaAdmin kafkaAdmin, LogManagerProperties properties) {
        this.kafkaAdmin = kafkaAdmin;
        this.settings = properties.getIngest().getKafka();
    }

    @Override
    public Health health() {
        try (AdminClient adminClient = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            DescribeClusterResult cluster = adminClient.describeCluster(
                    new DescribeClusterOptions().timeoutMs(TIMEOUT_MS));
            String clusterId = cluster.clusterId().get(5, TimeUnit.SECONDS);
            int nodeCount = cluster.nodes().get(5, TimeUnit.SECONDS).size();

            Set<String> topics = adminClient.listTopics(new ListTopicsOptions().timeoutMs(TIMEOUT_MS))
                    .names().get(5, TimeUnit.SECONDS);
            boolean ingestTopicPresent = topics.contains(settings.getTopic());

            log.debug("Kafka health: clusterId={}, nodes={}, topic {} present={}",
                    clusterId, nodeCount, settings.getTopic(), ingestTopicPresent);

            return Health.up()
                    .withDetail("clusterId", clusterId)
                    .withDetail("nodes", nodeCount)
                    .withDetail("topic", settings.getTopic())
                    .withDetail("topicPresent", ingestTopicPresent)
                    .withDetail("dlqTopicPresent", topics.contains(settings.getDlqTopic()))
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Health.down(e).build();
        } catch (Exception e) {
            log.error("Kafka health check failed: {}", e.getMessage());
            return Health.down()
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", e.getMessage())
                    .build();
        }
    }
}
