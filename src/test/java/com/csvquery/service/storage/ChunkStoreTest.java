package com.csvquery.service.storage;

import com.csvquery.exception.InvalidUploadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChunkStore Tests")
class ChunkStoreTest {

    @TempDir
    Path tempDir;

    private ChunkStore store;

    @BeforeEach
    void setUp() throws IOException {
        store = new ChunkStore(tempDir.resolve("staging").toString());
    }

    private static ByteArrayInputStream bytes(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should write chunk under staging/user/dataset/chunk_index")
    void testPutChunk_Layout() throws IOException {
        Path written = store.putChunk("u1", "d1", 3, bytes("abc"));

        assertEquals(tempDir.resolve("staging").resolve("u1").resolve("d1").resolve("chunk_3"), written);
        assertEquals("abc", Files.readString(written));
    }

    @Test
    @DisplayName("Should accept chunks out of order and repeated directory creation")
    void testPutChunk_OutOfOrder() {
        store.putChunk("u1", "d1", 2, bytes("c"));
        store.putChunk("u1", "d1", 0, bytes("a"));
        store.putChunk("u1", "d1", 1, bytes("b"));

        Path dir = store.stagingDir("u1", "d1");
        assertTrue(Files.exists(dir.resolve("chunk_0")));
        assertTrue(Files.exists(dir.resolve("chunk_1")));
        assertTrue(Files.exists(dir.resolve("chunk_2")));
    }

    @Test
    @DisplayName("Should replace a resent chunk instead of appending")
    void testPutChunk_Resend() throws IOException {
        store.putChunk("u1", "d1", 0, bytes("first attempt, longer"));
        Path written = store.putChunk("u1", "d1", 0, bytes("retry"));

        assertEquals("retry", Files.readString(written));
    }

    @Test
    @DisplayName("Should keep uploads of different users apart")
    void testStagingDir_PerUser() {
        assertNotEquals(store.stagingDir("u1", "d1"), store.stagingDir("u2", "d1"));
    }

    @Test
    @DisplayName("Should reject path traversal in identifiers before writing")
    void testPutChunk_RejectsTraversal() {
        assertThrows(InvalidUploadException.class, () -> store.putChunk("..", "d1", 0, bytes("x")));
        assertThrows(InvalidUploadException.class, () -> store.putChunk("u1", "../d1", 0, bytes("x")));
        assertFalse(Files.exists(tempDir.resolve("d1")));
    }

    @Test
    @DisplayName("Should remove all staged chunks on discard")
    void testDiscard() {
        store.putChunk("u1", "d1", 0, bytes("a"));
        store.putChunk("u1", "d1", 1, bytes("b"));

        store.discard("u1", "d1");

        assertFalse(Files.exists(store.stagingDir("u1", "d1")));
        assertTrue(Files.exists(store.getStagingRoot().resolve("u1")));
    }

    @Test
    @DisplayName("Should tolerate discarding an upload that was never staged")
    void testDiscard_Missing() {
        assertDoesNotThrow(() -> store.discard("u9", "nothing"));
    }
}
