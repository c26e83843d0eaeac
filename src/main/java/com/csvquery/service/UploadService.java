package com.csvquery.service;

import com.csvquery.dto.UploadResponse;
import com.csvquery.exception.AppException;
import com.csvquery.exception.EnqueueException;
import com.csvquery.service.ingest.IngestionJob;
import com.csvquery.service.ingest.IngestionQueue;
import com.csvquery.service.storage.ChunkStore;
import com.csvquery.util.IdentifierValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Request-side half of ingestion: stage the chunk, and on the final index register a
 * version and queue the ingestion task. Nothing here assembles or parses the file.
 */
@Slf4j
@Service
public class UploadService {

    private final ChunkStore chunkStore;
    private final VersionRegistry versionRegistry;
    private final IngestionQueue ingestionQueue;
    private final Path dataDir;

    public UploadService(ChunkStore chunkStore,
                         VersionRegistry versionRegistry,
                         IngestionQueue ingestionQueue,
                         @Value("${app.storage.data-dir}") String dataDir) throws IOException {
        this.chunkStore = chunkStore;
        this.versionRegistry = versionRegistry;
        this.ingestionQueue = ingestionQueue;
        this.dataDir = Path.of(dataDir);
        Files.createDirectories(this.dataDir);
    }

    public Path finalPath(String userId, String datasetId, String versionId) {
        return dataDir.resolve(userId).resolve(datasetId + "-v" + versionId + ".csv");
    }

    /**
     * Completion is signalled by the index alone: when {@code chunkIndex == totalChunks - 1}
     * arrives the upload is handed to ingestion, even if earlier indices are still missing.
     * A gap is reported later by the assembler.
     */
    public UploadResponse receiveChunk(String datasetId, String userId, int chunkIndex, int totalChunks, InputStream body) {
        IdentifierValidator.requireSafeSegment("dataset_id", datasetId);
        IdentifierValidator.requireSafeSegment("user_id", userId);
        IdentifierValidator.requireChunkPosition(chunkIndex, totalChunks);

        chunkStore.putChunk(userId, datasetId, chunkIndex, body);

        if (chunkIndex != totalChunks - 1) {
            return UploadResponse.received(datasetId, chunkIndex, totalChunks);
        }

        String versionId = VersionRegistry.newVersionId();
        Path stagingDir = chunkStore.stagingDir(userId, datasetId);
        Path finalPath = finalPath(userId, datasetId, versionId);

        boolean registered = false;
        try {
            versionRegistry.register(datasetId, versionId, userId, finalPath.toString());
            registered = true;
            String taskId = ingestionQueue.submit(IngestionJob.create(
                    userId, datasetId, versionId, stagingDir.toString(), totalChunks, finalPath.toString()));
            log.info("Final chunk received for user={} dataset={}: version={} task={}", userId, datasetId, versionId, taskId);
            return UploadResponse.processing(datasetId, versionId, taskId);
        } catch (RuntimeException e) {
            log.error("Failed to process upload for user={} dataset={} version={}: {}",
                    userId, datasetId, versionId, e.getMessage());
            chunkStore.discard(userId, datasetId);
            if (registered) {
                try {
                    versionRegistry.markFailed(datasetId, versionId, userId);
                } catch (RuntimeException markError) {
                    e.addSuppressed(markError);
                }
            }
            if (e instanceof AppException) {
                throw e;
            }
            throw new EnqueueException("Failed to process upload: " + e.getMessage(), e);
        }
    }
}
