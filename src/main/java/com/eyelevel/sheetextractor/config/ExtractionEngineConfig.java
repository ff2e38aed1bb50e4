package com.eyelevel.sheetextractor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds application properties under the "app" prefix to a strongly-typed configuration object.
 * This provides centralized control over the worker pool, the queue, the watchdog and the pipeline.
 */
@Data
@ConfigurationProperties(prefix = "app")
public class ExtractionEngineConfig {

    private Worker worker = new Worker();
    private Queue queue = new Queue();
    private Watchdog watchdog = new Watchdog();
    private Pipeline pipeline = new Pipeline();
    private Storage storage = new Storage();

    @Data
    public static class Worker {
        private boolean enabled = true;
        private int concurrency = 4;
        private Duration dequeueTimeout = Duration.ofSeconds(5);
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private Duration idleBackoff = Duration.ofSeconds(1);
    }

    @Data
    public static class Queue {
        /**
         * {@code sqs} or {@code memory}.
         */
        private String type = "sqs";
        private String name;
        private Duration visibilityTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Watchdog {
        private Duration staleThreshold = Duration.ofMinutes(2);
        private Duration pendingRequeueThreshold = Duration.ofMinutes(5);
        private int maxAttempts = 3;
    }

    @Data
    public static class Pipeline {
        private long maxFileSize = 50L * 1024 * 1024;
        private ValidationFailurePolicy validationFailurePolicy = ValidationFailurePolicy.ANNOTATE;
        private Extract extract = new Extract();
        private Timeouts timeouts = new Timeouts();
        private Ai ai = new Ai();
    }

    /**
     * What happens to a job whose extracted data fails validation.
     */
    public enum ValidationFailurePolicy {
        /**
         * Complete the job and record {@code valid=false} in the validation results.
         */
        ANNOTATE,
        /**
         * Fail the job with {@code validation_failed} and store no extraction.
         */
        FAIL
    }

    @Data
    public static class Extract {
        private int maxConcurrency = 2;
    }

    @Data
    public static class Timeouts {
        private Duration parse = Duration.ofSeconds(60);
        private Duration extract = Duration.ofMinutes(5);
        private Duration validate = Duration.ofSeconds(30);
    }

    @Data
    public static class Ai {
        private RetryConfig retry = new RetryConfig();
    }

    @Data
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long initialDelayMs = 500;
        private double multiplier = 2.0;
        private long maxDelayMs = 5000;
    }

    @Data
    public static class Storage {
        /**
         * {@code s3} or {@code local}.
         */
        private String type = "s3";
        private String localRoot;
    }
}
