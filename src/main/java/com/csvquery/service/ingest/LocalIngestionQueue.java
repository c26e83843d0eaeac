package com.csvquery.service.ingest;

import com.csvquery.exception.EnqueueException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** In-process transport: the worker pool's own queue carries the job. */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.ingestion.queue", havingValue = "local", matchIfMissing = true)
public class LocalIngestionQueue implements IngestionQueue {

    private final IngestionDispatcher dispatcher;

    @Override
    public String submit(IngestionJob job) {
        try {
            return dispatcher.dispatch(job).getTaskId();
        } catch (RuntimeException e) {
            throw new EnqueueException("Failed to start ingestion for version " + job.versionId() + ": " + e.getMessage(), e);
        }
    }
}
