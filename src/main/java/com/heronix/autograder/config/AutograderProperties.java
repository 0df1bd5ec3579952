package com.heronix.autograder.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for the Heronix autograder record service.
 */
@Data
@ConfigurationProperties(prefix = "heronix.autograder")
public class AutograderProperties {

    /**
     * Record store configuration
     */
    private StoreConfig store = new StoreConfig();

    /**
     * Submission batch configuration
     */
    private BatchConfig batches = new BatchConfig();

    /**
     * User notice configuration
     */
    private NoticeConfig notices = new NoticeConfig();

    @Data
    public static class StoreConfig {
        /**
         * Store implementation: "rest" (PostgREST-compatible) or "memory"
         */
        private String mode = "rest";

        /**
         * Base URL of the record store; the REST API lives under /rest/v1
         */
        private String baseUrl = "http://localhost:54321";

        /**
         * API key sent as both the apikey header and the bearer token.
         * In production, use environment variable: AUTOGRADER_STORE_API_KEY
         */
        private String apiKey;

        /**
         * Per-request timeout in seconds
         */
        private int timeoutSeconds = 15;

        /**
         * Retry attempts for failed reads. Writes are never retried.
         */
        private int retryAttempts = 2;

        /**
         * Initial backoff between read retries in milliseconds
         */
        private long retryDelayMs = 250;
    }

    @Data
    public static class BatchConfig {
        /**
         * Prefix of the display name synthesized for unnamed batches
         */
        private String defaultNamePrefix = "Batch ";
    }

    @Data
    public static class NoticeConfig {
        /**
         * Number of recent user notices kept for the notices endpoint
         */
        private int bufferSize = 100;
    }
}
