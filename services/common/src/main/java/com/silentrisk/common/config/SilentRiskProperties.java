package com.silentrisk.common.config;

import com.silentrisk.common.queue.TaskQueueTopics;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "silentrisk")
public class SilentRiskProperties {

    private Cache cache = new Cache();
    private Kafka kafka = new Kafka();
    private StatusBus statusBus = new StatusBus();
    private Ownership ownership = new Ownership();
    private Rpc rpc = new Rpc();
    private ResultPublish resultPublish = new ResultPublish();
    private Passport passport = new Passport();
    private Websocket websocket = new Websocket();

    @Data
    public static class Cache {
        private Duration taskTtl = Duration.ofHours(1);
        private Duration analysisTtl = Duration.ofHours(1);
        private Duration strategyTtl = Duration.ofHours(1);
    }

    @Data
    public static class Kafka {
        private Topics topics = new Topics();
        private String consumerGroup = TaskQueueTopics.CONSUMER_GROUP;
        private Duration sendTimeout = Duration.ofSeconds(30);
        private Duration redeliveryInterval = Duration.ofSeconds(5);
        private long maxRedeliveries = 10;

        @Data
        public static class Topics {
            private String riskRequests = TaskQueueTopics.RISK_ANALYSIS_REQUESTS;
            private String riskResults = TaskQueueTopics.RISK_ANALYSIS_RESULTS;
            private String strategyRequests = TaskQueueTopics.STRATEGY_VALIDATION_REQUESTS;
            private String strategyResults = TaskQueueTopics.STRATEGY_VALIDATION_RESULTS;
        }
    }

    @Data
    public static class StatusBus {
        private String channel = "task_status_updates";
        private Duration recoveryInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class Ownership {
        private Duration maxAge = Duration.ofSeconds(300);
        private Duration maxClockSkew = Duration.ofSeconds(60);
        private String messageTemplate = "Silent Risk Analysis: {wallet} at {timestamp}";
    }

    @Data
    public static class Rpc {
        private String url = "http://localhost:8545";
        private Duration timeout = Duration.ofSeconds(30);
        private int recentBlockWindow = 200;
        private int firstBlockSearchIterations = 20;
        private Duration averageBlockTime = Duration.ofSeconds(13);
        private int contractScanBlocks = 200;
        private int maxSampledTransactions = 100;
        /**
         * Upper bound for one complete collection, across all sub-queries.
         */
        private Duration collectionTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class ResultPublish {
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(500);
    }

    @Data
    public static class Passport {
        private String vaultAddress = "0x0000000000000000000000000000000000000000";
    }

    @Data
    public static class Websocket {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000", "http://localhost:3001"));
        private int maxConnections = 1000;
        /**
         * Longest a single send may block before the connection is dropped.
         */
        private Duration sendTimeLimit = Duration.ofSeconds(10);
        private int sendBufferSizeLimit = 512 * 1024;
    }
}
