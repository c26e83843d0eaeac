package com.csvquery.service.storage;

import com.csvquery.config.IngestionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes abandoned staging directories ({@code {staging}/{user}/{dataset}}) whose age
 * exceeds the configured TTL. A failure on one directory never stops the sweep.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleUploadReaper {

    private final ChunkStore chunkStore;
    private final IngestionProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "#{@ingestionProperties.reaper.interval.toMillis()}",
            initialDelayString = "#{@ingestionProperties.reaper.interval.toMillis()}")
    public void scheduledSweep() {
        int removed = sweep();
        if (removed > 0) {
            log.info("Stale upload sweep removed {} staging directories", removed);
        }
    }

    /** @return number of staging directories deleted */
    public int sweep() {
        Path root = chunkStore.getStagingRoot();
        if (!Files.isDirectory(root)) {
            return 0;
        }
        Duration ttl = properties.getReaper().getTtl();
        Instant now = clock.instant();
        int removed = 0;

        try (DirectoryStream<Path> users = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path userDir : users) {
                try (DirectoryStream<Path> datasets = Files.newDirectoryStream(userDir, Files::isDirectory)) {
                    for (Path datasetDir : datasets) {
                        if (reapIfStale(datasetDir, now, ttl)) {
                            removed++;
                        }
                    }
                } catch (IOException e) {
                    log.error("Error scanning staging directory {}: {}", userDir, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Error cleaning up stale uploads under {}: {}", root, e.getMessage());
        }
        return removed;
    }

    private boolean reapIfStale(Path datasetDir, Instant now, Duration ttl) {
        try {
            Duration age = Duration.between(createdAt(datasetDir), now);
            if (age.compareTo(ttl) <= 0) {
                return false;
            }
            if (deleteDirectory(datasetDir)) {
                log.info("Cleaned up stale upload: {} (age {})", datasetDir, age);
                return true;
            }
            log.warn("Stale upload {} could not be fully removed, will retry next sweep", datasetDir);
        } catch (IOException e) {
            log.warn("Cannot read age of {}: {}", datasetDir, e.getMessage());
        }
        return false;
    }

    /** @return true if the directory is gone afterwards */
    boolean deleteDirectory(Path dir) {
        return FileTrees.deleteRecursively(dir);
    }

    static Instant createdAt(Path dir) throws IOException {
        return Files.readAttributes(dir, BasicFileAttributes.class).creationTime().toInstant();
    }
}
