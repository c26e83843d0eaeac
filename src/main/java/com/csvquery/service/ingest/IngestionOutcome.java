package com.csvquery.service.ingest;

/**
 * Result of one attempt: {@code SUCCEEDED}, {@code RETRYING(attempt)} or
 * {@code FAILED_PERMANENTLY(reason)}.
 */
public record IngestionOutcome(IngestionState state, int attempt, String reason) {

    public static IngestionOutcome succeeded(int attempt) {
        return new IngestionOutcome(IngestionState.SUCCEEDED, attempt, null);
    }

    public static IngestionOutcome retrying(int attempt, String reason) {
        return new IngestionOutcome(IngestionState.RETRYING, attempt, reason);
    }

    public static IngestionOutcome failedPermanently(int attempt, String reason) {
        return new IngestionOutcome(IngestionState.FAILED_PERMANENTLY, attempt, reason);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
