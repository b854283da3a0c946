package com.socialintel.collector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "collector")
@Data
public class CollectorProperties {

    private Api api = new Api();
    private Token token = new Token();
    private RateLimit rateLimit = new RateLimit();
    private Worker worker = new Worker();
    private Progress progress = new Progress();
    private Output output = new Output();

    @Data
    public static class Api {
        private String baseUrl = "https://api.vk.com/method";
        private String version = "5.199";
        private Duration connectTimeout = Duration.ofSeconds(10);
        /** Per-call bound on any single HTTP request. */
        private Duration readTimeout = Duration.ofSeconds(30);
        private int pageSize = 100;
        /** groups.getById accepts at most this many ids per call. */
        private int groupsBatchSize = 500;
    }

    @Data
    public static class Token {
        private String accessToken = "";
        private String userId = "service";
        /** Lifetime assumed for the configured token; service tokens are long-lived. */
        private Duration lifetime = Duration.ofHours(24);
        /** Tokens this close to expiry are renewed before use. */
        private Duration safetyMargin = Duration.ofMinutes(5);
    }

    @Data
    public static class RateLimit {
        /** Global quota R of the external API, requests per second. */
        private int requestsPerSecond = 3;
    }

    @Data
    public static class Worker {
        private int concurrency = 2;
        private int phaseConcurrency = 4;
        private long pollIntervalMs = 500;
        /** A phase whose failed/attempted ratio exceeds this fails the job. */
        private double errorRateThreshold = 0.5;
        private int minItemsForErrorRate = 5;
        /** Optional; jobs running longer are cancelled cooperatively. */
        private Duration jobDeadline;
    }

    @Data
    public static class Progress {
        private Weights weights = new Weights();
        private int avgPostsPerGroup = 50;
        private int avgCommentsPerPost = 15;
        private long minEstimatedTotal = 100;

        @Data
        public static class Weights {
            private double groups = 0.10;
            private double posts = 0.30;
            private double comments = 0.60;
        }
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.JDBC;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "./data/output";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            JDBC, CSV, BOTH
        }
    }
}
