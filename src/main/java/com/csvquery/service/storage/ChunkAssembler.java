package com.csvquery.service.storage;

import com.csvquery.exception.ChunkWriteException;
import com.csvquery.exception.MissingChunkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Rebuilds the uploaded file from its staged chunks in index order, whatever order
 * they arrived in.
 */
@Slf4j
@Component
public class ChunkAssembler {

    public long assemble(Path stagingDir, int totalChunks, Path destination) {
        try {
            // every chunk must be present before the destination is opened
            for (int i = 0; i < totalChunks; i++) {
                if (!Files.isRegularFile(ChunkStore.chunkPath(stagingDir, i))) {
                    throw new MissingChunkException(i);
                }
            }

            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(destination,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                for (int i = 0; i < totalChunks; i++) {
                    Path chunkPath = ChunkStore.chunkPath(stagingDir, i);
                    if (!Files.exists(chunkPath)) {
                        // removed between the check above and now
                        throw new MissingChunkException(i);
                    }
                    try (InputStream in = Files.newInputStream(chunkPath)) {
                        in.transferTo(out);
                    }
                }
            }
            long size = Files.size(destination);
            log.debug("Assembled {} chunks from {} into {} ({} bytes)", totalChunks, stagingDir, destination, size);
            return size;
        } catch (IOException e) {
            deletePartial(destination);
            throw new ChunkWriteException("Failed to assemble " + destination + ": " + e.getMessage(), e);
        } catch (MissingChunkException e) {
            deletePartial(destination);
            throw e;
        }
    }

    /** A failed assembly never leaves a destination file, not even one from an earlier run. */
    private void deletePartial(Path destination) {
        try {
            Files.deleteIfExists(destination);
        } catch (IOException e) {
            log.warn("Could not remove partial file {}: {}", destination, e.getMessage());
        }
    }
}
