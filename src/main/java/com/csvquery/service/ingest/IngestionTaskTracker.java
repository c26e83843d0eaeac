package com.csvquery.service.ingest;

import com.csvquery.config.IngestionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tasks dispatched in this process, by task id. Finished tasks are kept for
 * {@code app.ingestion.tracker-retention} so their status can still be read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionTaskTracker {

    private final ConcurrentMap<String, IngestionTask> tasks = new ConcurrentHashMap<>();
    private final IngestionProperties properties;
    private final Clock clock;

    public void track(IngestionTask task) {
        tasks.put(task.getTaskId(), task);
    }

    public Optional<IngestionTask> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public int size() {
        return tasks.size();
    }

    @Scheduled(fixedDelayString = "#{@ingestionProperties.trackerRetention.toMillis()}",
            initialDelayString = "#{@ingestionProperties.trackerRetention.toMillis()}")
    public void evictFinished() {
        Instant cutoff = clock.instant().minus(properties.getTrackerRetention());
        int before = tasks.size();
        tasks.values().removeIf(t -> t.getFinishedAt() != null && t.getFinishedAt().isBefore(cutoff));
        int evicted = before - tasks.size();
        if (evicted > 0) {
            log.debug("Evicted {} finished ingestion tasks", evicted);
        }
    }
}
