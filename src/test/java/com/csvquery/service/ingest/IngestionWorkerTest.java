package com.csvquery.service.ingest;

import com.csvquery.exception.SchemaInferenceException;
import com.csvquery.exception.TaskTimeoutException;
import com.csvquery.service.storage.ChunkAssembler;
import com.csvquery.service.storage.ChunkStore;
import com.csvquery.service.table.TableMaterializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("IngestionWorker Tests")
class IngestionWorkerTest {

    @TempDir
    Path tempDir;

    private ChunkStore store;
    private TableMaterializer materializer;
    private IngestionWorker worker;
    private Path destination;

    @BeforeEach
    void setUp() throws IOException {
        store = new ChunkStore(tempDir.resolve("staging").toString());
        materializer = mock(TableMaterializer.class);
        worker = new IngestionWorker(new ChunkAssembler(), materializer, Clock.systemUTC());
        destination = tempDir.resolve("data").resolve("u1").resolve("d1-vv1.csv");

        store.putChunk("u1", "d1", 0, stream("name,age\n"));
        store.putChunk("u1", "d1", 1, stream("Alice,30\n"));
    }

    private static ByteArrayInputStream stream(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    private IngestionTask newTask(int totalChunks, int maxRetries) {
        IngestionJob job = IngestionJob.create("u1", "d1", "v1",
                store.stagingDir("u1", "d1").toString(), totalChunks, destination.toString());
        Instant now = Instant.now();
        return new IngestionTask(job, maxRetries, now, now.plus(Duration.ofHours(1)));
    }

    @Test
    @DisplayName("Should keep the assembled file and drop the chunks on success")
    void testRunAttempt_Success() throws IOException {
        when(materializer.namespaceExists("u1")).thenReturn(true);
        IngestionTask task = newTask(2, 3);

        IngestionOutcome outcome = worker.runAttempt(task);

        assertEquals(IngestionState.SUCCEEDED, outcome.state());
        assertEquals("name,age\nAlice,30\n", Files.readString(destination));
        assertFalse(Files.exists(store.stagingDir("u1", "d1")));
        verify(materializer).materialize(eq("u1"), eq("d1"), eq("v1"), eq(destination));
    }

    @Test
    @DisplayName("Should remove both staging and destination when materialization fails")
    void testRunAttempt_MaterializeFails() {
        doThrow(new SchemaInferenceException("bad csv"))
                .when(materializer).materialize(any(), any(), any(), any());
        IngestionTask task = newTask(2, 3);

        IngestionOutcome outcome = worker.runAttempt(task);

        assertEquals(IngestionState.RETRYING, outcome.state());
        assertEquals(1, outcome.attempt());
        assertEquals("bad csv", outcome.reason());
        assertFalse(Files.exists(destination));
        assertFalse(Files.exists(store.stagingDir("u1", "d1")));
    }

    @Test
    @DisplayName("Should fail at assembly without touching the table store when a chunk is missing")
    void testRunAttempt_MissingChunk() {
        IngestionTask task = newTask(3, 3);

        IngestionOutcome outcome = worker.runAttempt(task);

        assertEquals(IngestionState.RETRYING, outcome.state());
        assertEquals("Missing chunk 2", outcome.reason());
        verify(materializer, never()).materialize(any(), any(), any(), any());
        assertFalse(Files.exists(destination));
    }

    @Test
    @DisplayName("Should fail permanently when no retries remain")
    void testRunAttempt_NoRetriesLeft() {
        doThrow(new SchemaInferenceException("bad csv"))
                .when(materializer).materialize(any(), any(), any(), any());
        IngestionTask task = newTask(2, 0);

        IngestionOutcome outcome = worker.runAttempt(task);

        assertEquals(IngestionState.FAILED_PERMANENTLY, outcome.state());
        assertNotNull(task.getFinishedAt());
    }

    @Test
    @DisplayName("Should fail the attempt when the namespace is missing after materialization")
    void testRunAttempt_NamespaceMissing() {
        when(materializer.namespaceExists("u1")).thenReturn(false);
        IngestionTask task = newTask(2, 3);

        IngestionOutcome outcome = worker.runAttempt(task);

        assertEquals(IngestionState.RETRYING, outcome.state());
        assertTrue(outcome.reason().contains("namespace"));
        assertFalse(Files.exists(destination));
    }

    @Test
    @DisplayName("Should drop a table written after the task timed out")
    void testRunAttempt_TimedOutDuringMaterialize() {
        IngestionTask task = newTask(2, 3);
        doAnswer(inv -> {
            task.timeOut(new TaskTimeoutException(task.getTaskId(), Duration.ofMillis(1)), Instant.now());
            return null;
        }).when(materializer).materialize(any(), any(), any(), any());

        IngestionOutcome outcome = worker.runAttempt(task);

        assertEquals(IngestionState.FAILED_PERMANENTLY, outcome.state());
        verify(materializer).drop("u1", "d1_vv1");
        verify(materializer, never()).namespaceExists(any());
        assertFalse(Files.exists(destination));
        assertFalse(Files.exists(store.stagingDir("u1", "d1")));
    }

    @Test
    @DisplayName("Should not write a table when the task timed out during assembly")
    void testRunAttempt_TimedOutDuringAssembly() {
        IngestionTask task = newTask(2, 3);
        ChunkAssembler assembler = spy(new ChunkAssembler());
        doAnswer(inv -> {
            Object size = inv.callRealMethod();
            task.timeOut(new TaskTimeoutException(task.getTaskId(), Duration.ofMillis(1)), Instant.now());
            return size;
        }).when(assembler).assemble(any(), anyInt(), any());
        IngestionWorker slowWorker = new IngestionWorker(assembler, materializer, Clock.systemUTC());

        IngestionOutcome outcome = slowWorker.runAttempt(task);

        assertEquals(IngestionState.FAILED_PERMANENTLY, outcome.state());
        verify(materializer, never()).materialize(any(), any(), any(), any());
        assertFalse(Files.exists(destination));
    }

    @Test
    @DisplayName("Should not run an attempt for a task that already finished")
    void testRunAttempt_Terminal() {
        when(materializer.namespaceExists("u1")).thenReturn(true);
        IngestionTask task = newTask(2, 3);
        worker.runAttempt(task);

        IngestionOutcome again = worker.runAttempt(task);

        assertEquals(IngestionState.SUCCEEDED, again.state());
        assertEquals(1, task.getAttempts());
        verify(materializer, times(1)).materialize(any(), any(), any(), any());
    }
}
