package com.csvquery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Binding for {@code app.ingestion.*}.
 *
 * <pre>
 * app:
 *   ingestion:
 *     queue: local            # local | redis
 *     max-retries: 3
 *     retry-backoff: 60s
 *     time-limit: 1h
 *     worker-threads: 4
 *     tracker-retention: 1h
 *     reaper:
 *       ttl: 24h
 *       interval: 1h
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.ingestion")
public class IngestionProperties {

    private String queue = "local";

    /** Retries after the first attempt; a task runs at most {@code maxRetries + 1} times. */
    private int maxRetries = 3;

    private Duration retryBackoff = Duration.ofSeconds(60);

    /** Wall-clock ceiling for a task, measured from submission across all attempts. */
    private Duration timeLimit = Duration.ofHours(1);

    private int workerThreads = 4;

    private int queueCapacity = 500;

    private Duration trackerRetention = Duration.ofHours(1);

    @NestedConfigurationProperty
    private ReaperConfig reaper = new ReaperConfig();

    @Data
    public static class ReaperConfig {
        private Duration ttl = Duration.ofHours(24);
        private Duration interval = Duration.ofHours(1);
    }
}
