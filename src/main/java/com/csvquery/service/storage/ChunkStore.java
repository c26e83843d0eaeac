package com.csvquery.service.storage;

import com.csvquery.exception.ChunkWriteException;
import com.csvquery.util.IdentifierValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Staging area for uploaded chunks, laid out as
 * {@code {staging-dir}/{userId}/{datasetId}/chunk_{index}}.
 */
@Slf4j
@Component
public class ChunkStore {

    static final String CHUNK_PREFIX = "chunk_";

    private final Path stagingRoot;

    public ChunkStore(@Value("${app.storage.staging-dir}") String stagingDir) throws IOException {
        this.stagingRoot = Path.of(stagingDir);
        Files.createDirectories(this.stagingRoot);
    }

    public Path getStagingRoot() {
        return stagingRoot;
    }

    public Path stagingDir(String userId, String datasetId) {
        return stagingRoot
                .resolve(IdentifierValidator.requireSafeSegment("user_id", userId))
                .resolve(IdentifierValidator.requireSafeSegment("dataset_id", datasetId));
    }

    public static Path chunkPath(Path stagingDir, int chunkIndex) {
        return stagingDir.resolve(CHUNK_PREFIX + chunkIndex);
    }

    /**
     * Writes one chunk. Arrival order does not matter and a resent index replaces the
     * earlier copy. A chunk that fails halfway is removed so the assembler sees a gap
     * instead of a truncated file.
     */
    public Path putChunk(String userId, String datasetId, int chunkIndex, InputStream body) {
        Path dir = stagingDir(userId, datasetId);
        Path chunkPath = chunkPath(dir, chunkIndex);
        try {
            Files.createDirectories(dir);
            try (OutputStream os = Files.newOutputStream(chunkPath,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                long written = body.transferTo(os);
                log.debug("Stored chunk {} for user={} dataset={} ({} bytes)", chunkIndex, userId, datasetId, written);
            }
            return chunkPath;
        } catch (IOException e) {
            try {
                Files.deleteIfExists(chunkPath);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new ChunkWriteException("Failed to save chunk " + chunkIndex + ": " + e.getMessage(), e);
        }
    }

    /** Drops every staged chunk for the upload; used when registration is rolled back. */
    public void discard(String userId, String datasetId) {
        Path dir = stagingDir(userId, datasetId);
        if (!FileTrees.deleteRecursively(dir)) {
            log.warn("Could not fully remove staging directory {}", dir);
        }
    }
}
