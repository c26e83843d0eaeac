package com.csvquery.service.ingest;

import com.csvquery.exception.EnqueueException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes jobs onto a Redis list; {@link RedisIngestionConsumer} on any instance pops
 * them and dispatches to its worker pool.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.ingestion.queue", havingValue = "redis")
public class RedisIngestionQueue implements IngestionQueue {

    private final RedisTemplate<String, Object> redisTemplate;
    private final String queueKey;

    public RedisIngestionQueue(RedisTemplate<String, Object> redisTemplate,
                               @Value("${app.ingestion.redis-queue-key:ingestion-queue}") String queueKey) {
        this.redisTemplate = redisTemplate;
        this.queueKey = queueKey;
    }

    @Override
    public String submit(IngestionJob job) {
        try {
            redisTemplate.opsForList().rightPush(queueKey, job);
        } catch (RuntimeException e) {
            throw new EnqueueException("Failed to queue ingestion for version " + job.versionId() + ": " + e.getMessage(), e);
        }
        log.debug("Queued ingestion task={} on {}", job.taskId(), queueKey);
        return job.taskId();
    }
}
