package com.csvquery.service.ingest;

/**
 * Hand-off from the request path to the ingestion workers. Implementations must not run
 * the job on the calling thread.
 */
public interface IngestionQueue {

    /**
     * @return the task id callers can use to look up progress
     * @throws com.csvquery.exception.EnqueueException if the job could not be accepted
     */
    String submit(IngestionJob job);
}
