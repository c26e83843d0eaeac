package com.csvquery.service.ingest;

import com.csvquery.exception.TaskTimeoutException;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one ingestion across its attempts.
 * <pre>
 * PENDING -> RUNNING -> SUCCEEDED | RETRYING | FAILED_PERMANENTLY
 * RETRYING -> RUNNING
 * </pre>
 * Transitions are synchronized; once terminal the state never changes again.
 */
@Getter
public class IngestionTask {

    private final IngestionJob job;
    private final int maxRetries;
    private final Instant submittedAt;
    private final Instant deadline;

    private IngestionState state = IngestionState.PENDING;
    private int attempts;
    private String lastError;
    private Instant finishedAt;

    private final CompletableFuture<IngestionOutcome> completion = new CompletableFuture<>();
    private final AtomicBoolean finalized = new AtomicBoolean();

    private volatile Future<?> currentAttempt;
    private volatile Future<?> pendingRetry;
    private volatile Future<?> watchdog;

    public IngestionTask(IngestionJob job, int maxRetries, Instant submittedAt, Instant deadline) {
        this.job = job;
        this.maxRetries = maxRetries;
        this.submittedAt = submittedAt;
        this.deadline = deadline;
    }

    public String getTaskId() {
        return job.taskId();
    }

    /** Retries consumed so far; the first attempt is not a retry. */
    public synchronized int getRetries() {
        return Math.max(0, attempts - 1);
    }

    public synchronized IngestionState getState() {
        return state;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public synchronized String getLastError() {
        return lastError;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized boolean isTerminal() {
        return state.isTerminal();
    }

    /** @return false if the task already reached a terminal state and must not run again */
    synchronized boolean start() {
        if (state.isTerminal()) {
            return false;
        }
        state = IngestionState.RUNNING;
        attempts++;
        return true;
    }

    synchronized IngestionOutcome succeed(Instant now) {
        if (state.isTerminal()) {
            return currentOutcome();
        }
        state = IngestionState.SUCCEEDED;
        finishedAt = now;
        return IngestionOutcome.succeeded(attempts);
    }

    synchronized IngestionOutcome fail(Throwable cause, Instant now) {
        if (state.isTerminal()) {
            return currentOutcome();
        }
        lastError = describe(cause);
        if (cause instanceof TaskTimeoutException || attempts > maxRetries) {
            state = IngestionState.FAILED_PERMANENTLY;
            finishedAt = now;
            return IngestionOutcome.failedPermanently(attempts, lastError);
        }
        state = IngestionState.RETRYING;
        return IngestionOutcome.retrying(attempts, lastError);
    }

    /** @return true if this call ended the task; false if it had already finished */
    synchronized boolean timeOut(TaskTimeoutException cause, Instant now) {
        if (state.isTerminal()) {
            return false;
        }
        fail(cause, now);
        return true;
    }

    synchronized IngestionOutcome currentOutcome() {
        return new IngestionOutcome(state, attempts, lastError);
    }

    /** Claims the one-time terminal side effects (status update, completion). */
    boolean claimFinalization() {
        return finalized.compareAndSet(false, true);
    }

    void complete(IngestionOutcome outcome) {
        completion.complete(outcome);
    }

    void setCurrentAttempt(Future<?> f) { this.currentAttempt = f; }
    void setPendingRetry(Future<?> f) { this.pendingRetry = f; }
    void setWatchdog(Future<?> f) { this.watchdog = f; }

    private static String describe(Throwable cause) {
        String msg = cause.getMessage();
        return msg != null ? msg : cause.getClass().getSimpleName();
    }
}
