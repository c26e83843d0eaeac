package com.csvquery.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UploadResponse(
        String status,
        String message,
        String datasetId,
        String versionId,
        String taskId,
        @JsonProperty("is_final_chunk") boolean isFinalChunk
) {
    public static final String RECEIVED = "received";
    public static final String PROCESSING = "processing";

    public static UploadResponse received(String datasetId, int chunkIndex, int totalChunks) {
        return new UploadResponse(RECEIVED,
                "Chunk " + (chunkIndex + 1) + "/" + totalChunks + " received.",
                datasetId, null, null, false);
    }

    public static UploadResponse processing(String datasetId, String versionId, String taskId) {
        return new UploadResponse(PROCESSING, "Final chunk received. Processing started.",
                datasetId, versionId, taskId, true);
    }
}
