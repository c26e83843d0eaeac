package com.csvquery.service.ingest;

import com.csvquery.config.IngestionProperties;
import com.csvquery.exception.TaskTimeoutException;
import com.csvquery.service.VersionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Future;

/**
 * Owns the retry loop. Each attempt runs on the ingestion worker pool; its
 * {@link IngestionOutcome} decides whether the task finishes or is rescheduled after the
 * fixed backoff. A watchdog fires at the task deadline and ends the task regardless of
 * which attempt is in flight.
 */
@Slf4j
@Component
public class IngestionDispatcher {

    private final IngestionWorker worker;
    private final IngestionTaskTracker tracker;
    private final VersionRegistry versionRegistry;
    private final AsyncTaskExecutor executor;
    private final TaskScheduler scheduler;
    private final IngestionProperties properties;
    private final Clock clock;

    public IngestionDispatcher(IngestionWorker worker,
                               IngestionTaskTracker tracker,
                               VersionRegistry versionRegistry,
                               @Qualifier("ingestionExecutor") AsyncTaskExecutor executor,
                               @Qualifier("taskScheduler") TaskScheduler scheduler,
                               IngestionProperties properties,
                               Clock clock) {
        this.worker = worker;
        this.tracker = tracker;
        this.versionRegistry = versionRegistry;
        this.executor = executor;
        this.scheduler = scheduler;
        this.properties = properties;
        this.clock = clock;
    }

    public IngestionTask dispatch(IngestionJob job) {
        Instant now = clock.instant();
        IngestionTask task = new IngestionTask(job, properties.getMaxRetries(), now, now.plus(properties.getTimeLimit()));
        tracker.track(task);
        task.setWatchdog(scheduler.schedule(() -> onDeadline(task), task.getDeadline()));
        log.info("Dispatched ingestion task={} user={} dataset={} version={}",
                job.taskId(), job.userId(), job.datasetId(), job.versionId());
        submitAttempt(task);
        return task;
    }

    private void submitAttempt(IngestionTask task) {
        try {
            task.setCurrentAttempt(executor.submit(() -> advance(task, worker.runAttempt(task))));
        } catch (TaskRejectedException e) {
            // worker pool saturated: counts as a failed attempt, so it retries with backoff
            log.warn("Ingestion worker pool rejected task={}: {}", task.getTaskId(), e.getMessage());
            task.start();
            advance(task, task.fail(e, clock.instant()));
        }
    }

    private void advance(IngestionTask task, IngestionOutcome outcome) {
        switch (outcome.state()) {
            case RETRYING -> {
                Instant next = clock.instant().plus(properties.getRetryBackoff());
                log.warn("Ingestion task={} attempt {} failed, retrying at {}: {}",
                        task.getTaskId(), outcome.attempt(), next, outcome.reason());
                task.setPendingRetry(scheduler.schedule(() -> submitAttempt(task), next));
            }
            case SUCCEEDED, FAILED_PERMANENTLY -> finish(task, outcome);
            default -> throw new IllegalStateException("Attempt ended in non-final state " + outcome.state());
        }
    }

    private void onDeadline(IngestionTask task) {
        TaskTimeoutException timeout = new TaskTimeoutException(task.getTaskId(), properties.getTimeLimit());
        if (!task.timeOut(timeout, clock.instant())) {
            return;
        }
        log.error("Ingestion task={} killed: {}", task.getTaskId(), timeout.getMessage());
        cancel(task.getCurrentAttempt(), true);
        cancel(task.getPendingRetry(), false);
        worker.cleanupAfterFailure(task.getJob());
        finish(task, task.currentOutcome());
    }

    private void finish(IngestionTask task, IngestionOutcome outcome) {
        if (!task.claimFinalization()) {
            return;
        }
        cancel(task.getWatchdog(), false);
        cancel(task.getPendingRetry(), false);
        IngestionJob job = task.getJob();
        try {
            if (outcome.state() == IngestionState.SUCCEEDED) {
                versionRegistry.markReady(job.datasetId(), job.versionId(), job.userId());
            } else {
                log.error("Failed to process CSV after {} retries: task={} user={} dataset={} version={}: {}",
                        task.getRetries(), job.taskId(), job.userId(), job.datasetId(), job.versionId(), outcome.reason());
                versionRegistry.markFailed(job.datasetId(), job.versionId(), job.userId());
            }
        } catch (RuntimeException e) {
            log.error("Could not record outcome {} for version {} of dataset {}",
                    outcome.state(), job.versionId(), job.datasetId(), e);
        } finally {
            task.complete(outcome);
        }
    }

    private static void cancel(Future<?> future, boolean interrupt) {
        if (future != null && !future.isDone()) {
            future.cancel(interrupt);
        }
    }
}
