package com.example.sheetstream.stream;

import com.example.sheetstream.exception.SpillFileException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class SpillBufferTest {

    @TempDir
    Path tempDir;

    private long filesIn(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.count();
        }
    }

    @Test
    public void testKeepsContentInMemoryBelowThreshold() throws IOException {
        SpillBuffer buffer = new SpillBuffer(1024, tempDir, "test-");
        buffer.append("<row r=\"1\"></row>");

        assertFalse(buffer.spillIfNeeded());
        assertFalse(buffer.hasSpillFile());
        assertEquals(0, filesIn(tempDir));
        assertEquals("<row r=\"1\"></row>", new String(buffer.drain(), StandardCharsets.UTF_8));
    }

    @Test
    public void testSpillsOnceThresholdIsReached() throws IOException {
        SpillBuffer buffer = new SpillBuffer(16, tempDir, "test-");
        buffer.append("0123456789");
        assertFalse(buffer.spillIfNeeded());

        buffer.append("abcdef");
        assertTrue(buffer.spillIfNeeded());
        assertEquals(0, buffer.size());
        assertEquals(16, buffer.getSpilledBytes());
        assertEquals(16, buffer.totalSize());
        assertTrue(buffer.hasSpillFile());
        assertEquals(1, filesIn(tempDir));
        assertTrue(buffer.getSpillFile().getFileName().toString().startsWith("test-"));
    }

    @Test
    public void testReusesTheSpillFileAndDrainsInOrder() throws IOException {
        SpillBuffer buffer = new SpillBuffer(8, tempDir, "test-");
        buffer.append("first-chunk;");
        buffer.spillIfNeeded();
        Path spillFile = buffer.getSpillFile();

        buffer.append("second-chunk;");
        buffer.spillIfNeeded();
        assertEquals(spillFile, buffer.getSpillFile());
        assertEquals(1, filesIn(tempDir));

        buffer.append("tail");
        assertEquals("first-chunk;second-chunk;tail", new String(buffer.drain(), StandardCharsets.UTF_8));
        assertFalse(buffer.hasSpillFile());
        assertFalse(Files.exists(spillFile));
        assertEquals(0, filesIn(tempDir));
        assertEquals(0, buffer.totalSize());
    }

    @Test
    public void testEachSpillAppendsAtTheCommittedOffset() throws IOException {
        SpillBuffer buffer = new SpillBuffer(4096, tempDir, "test-");
        StringBuilder expected = new StringBuilder();
        for (int chunk = 0; chunk < 5; chunk++) {
            String markup = String.valueOf((char) ('a' + chunk)).repeat(5000);
            expected.append(markup);
            buffer.append(markup);
            assertTrue(buffer.spillIfNeeded());
            assertEquals((chunk + 1) * 5000L, Files.size(buffer.getSpillFile()));
        }

        assertEquals(25000, buffer.getSpilledBytes());
        assertEquals(expected.toString(), new String(buffer.drain(), StandardCharsets.UTF_8));
    }

    @Test
    public void testDegradesToMemoryWhenSpillFileCannotBeCreated() {
        SpillBuffer buffer = new SpillBuffer(4, tempDir.resolve("missing"), "test-");
        buffer.append("abcdef");

        assertFalse(buffer.spillIfNeeded());
        assertTrue(buffer.isDegraded());
        assertEquals(6, buffer.size());

        buffer.append("gh");
        assertFalse(buffer.spillIfNeeded());
        assertEquals("abcdefgh", new String(buffer.drain(), StandardCharsets.UTF_8));
    }

    @Test
    public void testResumesSpillingWhenTheDirectoryAppears() throws IOException {
        Path later = tempDir.resolve("later");
        SpillBuffer buffer = new SpillBuffer(4, later, "test-");
        buffer.append("abcdef");
        assertFalse(buffer.spillIfNeeded());

        Files.createDirectory(later);
        buffer.append("gh");
        assertTrue(buffer.spillIfNeeded());
        assertTrue(buffer.isDegraded());
        assertEquals("abcdefgh", new String(buffer.drain(), StandardCharsets.UTF_8));
        assertEquals(0, filesIn(later));
    }

    @Test
    public void testDiscardDeletesTheSpillFile() throws IOException {
        SpillBuffer buffer = new SpillBuffer(4, tempDir, "test-");
        buffer.append("abcdef");
        buffer.spillIfNeeded();
        buffer.append("gh");

        buffer.discard();

        assertEquals(0, filesIn(tempDir));
        assertEquals(0, buffer.totalSize());
        assertEquals(0, buffer.drain().length);
    }

    @Test
    public void testDrainFailsWhenSpillFileWasRemoved() throws IOException {
        SpillBuffer buffer = new SpillBuffer(4, tempDir, "test-");
        buffer.append("abcdef");
        buffer.spillIfNeeded();
        Files.delete(buffer.getSpillFile());

        assertThrows(SpillFileException.class, buffer::drain);
        assertFalse(buffer.hasSpillFile());
    }

    @Test
    public void testRejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new SpillBuffer(0, tempDir, "test-"));
    }
}
