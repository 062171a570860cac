package com.example.logmanager.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

@Data
@ConfigurationProperties(prefix = "logs")
public class LogManagerProperties {

    private Query query = new Query();
    private Analytics analytics = new Analytics();
    private Ingest ingest = new Ingest();
    private Broadcast broadcast = new Broadcast();

    @Data
    public static class Query {
        private int defaultLimit = 100;
        private int maxLimit = 10000;
        private int exportLimit = 10000;
        private int latestLimit = 100;
    }

    @Data
    public static class Analytics {
        /** Zone used for hour-of-day and calendar-day buckets. */
        private ZoneId zone = ZoneId.of("UTC");
        private int topN = 10;
    }

    @Data
    public static class Ingest {
        private Kafka kafka = new Kafka();
    }

    @Data
    public static class Kafka {
        private boolean enabled = false;
        private String topic = "logs";
        private String dlqTopic = "logs-dlq";
    }

    @Data
    public static class Broadcast {
        private boolean enabled = true;
        private Duration interval = Duration.ofMillis(250);
        private int batchSize = 250;
        /** Created logs waiting for the next flush; the oldest are dropped beyond this. */
        private int queueCapacity = 2000;
    }
}
