package com.csvquery.controller;

import com.csvquery.dto.UploadResponse;
import com.csvquery.entity.DatasetVersion;
import com.csvquery.exception.DatasetNotFoundException;
import com.csvquery.exception.TaskNotFoundException;
import com.csvquery.service.UploadService;
import com.csvquery.service.VersionRegistry;
import com.csvquery.service.ingest.IngestionState;
import com.csvquery.service.ingest.IngestionTask;
import com.csvquery.service.ingest.IngestionTaskTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;

@Slf4j
@RestController
@RequestMapping("/ingestion")
@RequiredArgsConstructor
public class UploadController {

    static final String LATEST = "latest";

    private final UploadService uploadService;
    private final VersionRegistry versionRegistry;
    private final IngestionTaskTracker taskTracker;

    // DTOs
    public record DatasetVersionResponse(String datasetId, String versionId, String userId, String filePath,
                                         String status, Instant createdAt) {
        static DatasetVersionResponse of(DatasetVersion v) {
            return new DatasetVersionResponse(v.getDatasetId(), v.getVersionId(), v.getUserId(), v.getFilePath(),
                    v.getStatus().name().toLowerCase(), v.getCreatedAt());
        }
    }

    public record TaskStatusResponse(String taskId, String datasetId, String versionId, IngestionState state,
                                     int attempts, int retries, String lastError, Instant submittedAt,
                                     Instant finishedAt) {
        static TaskStatusResponse of(IngestionTask t) {
            return new TaskStatusResponse(t.getTaskId(), t.getJob().datasetId(), t.getJob().versionId(), t.getState(),
                    t.getAttempts(), t.getRetries(), t.getLastError(), t.getSubmittedAt(), t.getFinishedAt());
        }
    }

    @PostMapping(value = "/upload-chunk", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResponse> uploadChunk(
            @RequestParam("dataset_id") String datasetId,
            @RequestParam("user_id") String userId,
            @RequestParam("chunk_index") int chunkIndex,
            @RequestParam("total_chunks") int totalChunks,
            @RequestPart("chunk") MultipartFile chunk
    ) throws IOException {
        log.debug("POST /ingestion/upload-chunk user={} dataset={} chunk={}/{}", userId, datasetId, chunkIndex, totalChunks);
        try (InputStream is = chunk.getInputStream()) {
            return ResponseEntity.ok(uploadService.receiveChunk(datasetId, userId, chunkIndex, totalChunks, is));
        }
    }

    @GetMapping("/datasets/{datasetId}/versions/{versionId}")
    public ResponseEntity<DatasetVersionResponse> getDatasetVersion(
            @PathVariable("datasetId") String datasetId,
            @PathVariable("versionId") String versionId,
            @RequestParam("user_id") String userId
    ) {
        var version = LATEST.equals(versionId)
                ? versionRegistry.findLatest(datasetId, userId)
                : versionRegistry.find(datasetId, versionId, userId);
        return version
                .map(v -> ResponseEntity.ok(DatasetVersionResponse.of(v)))
                .orElseThrow(() -> new DatasetNotFoundException("Dataset not found"));
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<TaskStatusResponse> getTask(@PathVariable("taskId") String taskId) {
        return taskTracker.find(taskId)
                .map(t -> ResponseEntity.ok(TaskStatusResponse.of(t)))
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }
}
