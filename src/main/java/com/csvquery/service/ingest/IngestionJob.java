package com.csvquery.service.ingest;

import java.util.UUID;

/**
 * Message handed from the upload path to the worker pool. Plain values only so it can
 * travel through Redis as JSON.
 */
public record IngestionJob(
        String taskId,
        String userId,
        String datasetId,
        String versionId,
        String stagingDir,
        int totalChunks,
        String destinationPath
) {
    public static IngestionJob create(String userId, String datasetId, String versionId,
                                      String stagingDir, int totalChunks, String destinationPath) {
        return new IngestionJob(UUID.randomUUID().toString(), userId, datasetId, versionId,
                stagingDir, totalChunks, destinationPath);
    }
}
