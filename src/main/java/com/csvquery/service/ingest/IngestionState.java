package com.csvquery.service.ingest;

public enum IngestionState {
    PENDING,
    RUNNING,
    RETRYING,
    SUCCEEDED,
    FAILED_PERMANENTLY;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED_PERMANENTLY;
    }
}
