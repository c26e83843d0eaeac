package com.csvquery.service.ingest;

import com.csvquery.exception.ChunkWriteException;
import com.csvquery.service.storage.ChunkAssembler;
import com.csvquery.service.storage.FileTrees;
import com.csvquery.service.table.TableMaterializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Runs a single ingestion attempt: assemble, materialize, clean up. Failures are turned
 * into an {@link IngestionOutcome} here; scheduling the next step is the dispatcher's job.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionWorker {

    private final ChunkAssembler assembler;
    private final TableMaterializer materializer;
    private final Clock clock;

    public IngestionOutcome runAttempt(IngestionTask task) {
        IngestionJob job = task.getJob();
        if (!task.start()) {
            return task.currentOutcome();
        }
        log.info("Ingestion attempt {}/{} task={} user={} dataset={} version={}",
                task.getAttempts(), task.getMaxRetries() + 1, job.taskId(), job.userId(), job.datasetId(), job.versionId());

        Path stagingDir = Path.of(job.stagingDir());
        Path destination = Path.of(job.destinationPath());
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            assembler.assemble(stagingDir, job.totalChunks(), destination);
            if (task.isTerminal()) {
                return abandon(task);
            }
            materializer.materialize(job.userId(), job.datasetId(), job.versionId(), destination);
            if (task.isTerminal()) {
                // the watchdog ended the task while the table was being written
                dropLateTable(job);
                return abandon(task);
            }
        } catch (IOException e) {
            return failAttempt(task, new ChunkWriteException("Cannot prepare " + destination + ": " + e.getMessage(), e));
        } catch (RuntimeException e) {
            return failAttempt(task, e);
        }

        // chunks go, the assembled file stays
        if (!FileTrees.deleteRecursively(stagingDir)) {
            log.warn("Staging directory {} was not fully removed", stagingDir);
        }

        if (!Files.exists(destination)) {
            return failAttempt(task, new IllegalStateException("CSV file not found at " + destination));
        }
        if (!materializer.namespaceExists(job.userId())) {
            return failAttempt(task, new IllegalStateException("Table namespace missing for user " + job.userId()));
        }

        log.info("Successfully processed CSV for user {}, dataset {}, version {}",
                job.userId(), job.datasetId(), job.versionId());
        return task.succeed(clock.instant());
    }

    /** Removes staged chunks and any partially written destination file. */
    public void cleanupAfterFailure(IngestionJob job) {
        Path stagingDir = Path.of(job.stagingDir());
        if (!FileTrees.deleteRecursively(stagingDir)) {
            log.warn("Staging directory {} was not fully removed", stagingDir);
        }
        try {
            Files.deleteIfExists(Path.of(job.destinationPath()));
        } catch (IOException e) {
            log.warn("Could not remove incomplete file {}: {}", job.destinationPath(), e.getMessage());
        }
    }

    private IngestionOutcome abandon(IngestionTask task) {
        IngestionJob job = task.getJob();
        log.warn("Ingestion task={} ended while attempt {} was running, discarding its work",
                job.taskId(), task.getAttempts());
        cleanupAfterFailure(job);
        return task.currentOutcome();
    }

    private void dropLateTable(IngestionJob job) {
        String table = TableMaterializer.tableName(job.datasetId(), job.versionId());
        try {
            materializer.drop(job.userId(), table);
        } catch (RuntimeException e) {
            log.error("Could not drop table {} of ended task={} for user {}: {}",
                    table, job.taskId(), job.userId(), e.getMessage());
        }
    }

    private IngestionOutcome failAttempt(IngestionTask task, RuntimeException cause) {
        IngestionJob job = task.getJob();
        log.error("Error processing CSV for user {}, dataset {}, version {} (attempt {}): {}",
                job.userId(), job.datasetId(), job.versionId(), task.getAttempts(), cause.getMessage());
        cleanupAfterFailure(job);
        return task.fail(cause, clock.instant());
    }
}
