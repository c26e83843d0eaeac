package com.csvquery.service.ingest;

import com.csvquery.service.VersionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(name = "app.ingestion.queue", havingValue = "redis")
public class RedisIngestionConsumer {

    private static final int MAX_JOBS_PER_POLL = 50;

    private final RedisTemplate<String, Object> redisTemplate;
    private final IngestionDispatcher dispatcher;
    private final VersionRegistry versionRegistry;
    // queued payloads use field names as written, independent of the web layer's naming strategy
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String queueKey;

    public RedisIngestionConsumer(RedisTemplate<String, Object> redisTemplate,
                                  IngestionDispatcher dispatcher,
                                  VersionRegistry versionRegistry,
                                  @Value("${app.ingestion.redis-queue-key:ingestion-queue}") String queueKey) {
        this.redisTemplate = redisTemplate;
        this.dispatcher = dispatcher;
        this.versionRegistry = versionRegistry;
        this.queueKey = queueKey;
    }

    @Scheduled(fixedDelayString = "${app.ingestion.redis-poll-interval-ms:1000}")
    public void poll() {
        int dispatched = 0;
        try {
            Object message;
            while (dispatched < MAX_JOBS_PER_POLL && (message = redisTemplate.opsForList().leftPop(queueKey)) != null) {
                IngestionJob job = toJob(message);
                if (job == null) {
                    log.error("Dropping unreadable message from {}: {}", queueKey, message);
                    continue;
                }
                if (!dispatch(job)) {
                    // leave the rest of the list for the next poll
                    break;
                }
                dispatched++;
            }
        } catch (RuntimeException e) {
            log.error("Polling {} failed after {} jobs: {}", queueKey, dispatched, e.getMessage(), e);
        }
    }

    /**
     * A job whose dispatch fails goes back to the head of the list. If even that fails the
     * job is lost, so its version is marked failed instead of staying pending.
     */
    private boolean dispatch(IngestionJob job) {
        try {
            dispatcher.dispatch(job);
            return true;
        } catch (RuntimeException e) {
            log.error("Dispatch of task={} failed, returning it to {}: {}", job.taskId(), queueKey, e.getMessage());
            try {
                redisTemplate.opsForList().leftPush(queueKey, job);
            } catch (RuntimeException requeueError) {
                log.error("Could not requeue task={} user={} dataset={} version={}, marking version failed: {}",
                        job.taskId(), job.userId(), job.datasetId(), job.versionId(), requeueError.getMessage());
                versionRegistry.markFailed(job.datasetId(), job.versionId(), job.userId());
            }
            return false;
        }
    }

    IngestionJob toJob(Object message) {
        if (message instanceof IngestionJob job) {
            return job;
        }
        try {
            return objectMapper.convertValue(message, IngestionJob.class);
        } catch (IllegalArgumentException e) {
            log.warn("Cannot convert queued message to IngestionJob: {}", e.getMessage());
            return null;
        }
    }
}
