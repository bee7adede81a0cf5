package com.example.sheetstream.stream;

import com.example.sheetstream.exception.SpillFileException;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Append-only buffer for row markup that moves its content to a temporary
 * file whenever it reaches the spill threshold, so memory use stays bounded
 * by roughly one threshold plus one row.
 *
 * The spill file is created lazily on the first spill and reused until
 * {@link #drain()} or {@link #discard()}. Content is written at the
 * committed offset and only the committed prefix is ever read back, so a
 * failed write leaves no trace in the payload.
 *
 * If the file cannot be created or written, the buffer keeps growing in
 * memory instead of failing the write. This is reported once as a warning
 * and through {@link #isDegraded()}; spilling is attempted again on the
 * next check.
 *
 * Not thread-safe.
 */
@Slf4j
public class SpillBuffer {

    private static final String SPILL_FILE_SUFFIX = ".xml";

    private final int threshold;
    private final Path tempDirectory;
    private final String tempFilePrefix;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream(8192);
    private Path spillFile;
    private FileChannel spillChannel;
    private long spilledBytes;
    private boolean degraded;

    /**
     * @param threshold      buffered size in bytes that triggers a spill
     * @param tempDirectory  directory for the spill file, or {@code null} for the platform default
     * @param tempFilePrefix spill file name prefix
     */
    public SpillBuffer(int threshold, Path tempDirectory, String tempFilePrefix) {
        if (threshold < 1) {
            throw new IllegalArgumentException("spill threshold must be positive: " + threshold);
        }
        this.threshold = threshold;
        this.tempDirectory = tempDirectory;
        this.tempFilePrefix = tempFilePrefix;
    }

    public void append(String markup) {
        byte[] bytes = markup.getBytes(StandardCharsets.UTF_8);
        buffer.write(bytes, 0, bytes.length);
    }

    /**
     * Bytes currently held in memory.
     */
    public int size() {
        return buffer.size();
    }

    /**
     * Bytes held in memory plus bytes committed to the spill file.
     */
    public long totalSize() {
        return spilledBytes + buffer.size();
    }

    public long getSpilledBytes() {
        return spilledBytes;
    }

    public boolean hasSpillFile() {
        return spillFile != null;
    }

    Path getSpillFile() {
        return spillFile;
    }

    public boolean isDegraded() {
        return degraded;
    }

    /**
     * Move the buffered content to the spill file if the buffer has reached
     * the threshold.
     *
     * @return whether the buffer was spilled
     */
    public boolean spillIfNeeded() {
        if (buffer.size() < threshold) {
            return false;
        }
        if (spillChannel == null) {
            try {
                openSpillFile();
            } catch (IOException e) {
                enterDegradedMode("cannot create spill file", e);
                return false;
            }
        }
        int size = buffer.size();
        try {
            spillChannel.position(spilledBytes);
            // not closed: closing the stream would close the channel
            buffer.writeTo(Channels.newOutputStream(spillChannel));
        } catch (IOException e) {
            enterDegradedMode("cannot write spill file " + spillFile, e);
            return false;
        }
        spilledBytes += size;
        buffer.reset();
        log.debug("Spilled {} bytes to {} ({} bytes on disk)", size, spillFile, spilledBytes);
        return true;
    }

    /**
     * Return the whole content, spilled prefix first, and reset the buffer.
     * The spill file is deleted on every path.
     *
     * @throws SpillFileException if the spilled content cannot be read back or the file cannot be deleted
     */
    public byte[] drain() {
        if (spillFile == null) {
            byte[] content = buffer.toByteArray();
            buffer.reset();
            return content;
        }

        byte[] spilled;
        try {
            closeSpillChannel();
            spilled = readSpilledContent();
        } catch (IOException e) {
            SpillFileException failure = new SpillFileException("Failed to read spilled sheet data from " + spillFile, e);
            deleteSpillFile(failure);
            throw failure;
        } catch (RuntimeException e) {
            deleteSpillFile(e);
            throw e;
        }

        try {
            Files.delete(spillFile);
        } catch (IOException e) {
            throw new SpillFileException("Failed to delete spill file " + spillFile, e);
        } finally {
            spillFile = null;
            spilledBytes = 0;
        }

        ByteArrayOutputStream content = new ByteArrayOutputStream(spilled.length + buffer.size());
        content.write(spilled, 0, spilled.length);
        content.write(buffer.toByteArray(), 0, buffer.size());
        buffer.reset();
        return content.toByteArray();
    }

    /**
     * Drop all content and delete the spill file, if any.
     *
     * @throws SpillFileException if the spill file cannot be closed or deleted
     */
    public void discard() {
        buffer.reset();
        if (spillFile == null) {
            return;
        }
        try {
            closeSpillChannel();
            Files.deleteIfExists(spillFile);
        } catch (IOException e) {
            throw new SpillFileException("Failed to delete spill file " + spillFile, e);
        } finally {
            spillFile = null;
            spilledBytes = 0;
        }
    }

    private void openSpillFile() throws IOException {
        Path file = tempDirectory != null
                ? Files.createTempFile(tempDirectory, tempFilePrefix, SPILL_FILE_SUFFIX)
                : Files.createTempFile(tempFilePrefix, SPILL_FILE_SUFFIX);
        try {
            spillChannel = FileChannel.open(file, StandardOpenOption.WRITE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException deleteFailure) {
                e.addSuppressed(deleteFailure);
            }
            throw e;
        }
        spillFile = file;
        log.debug("Created spill file {}", file);
    }

    private byte[] readSpilledContent() throws IOException {
        if (spilledBytes > Integer.MAX_VALUE - 8) {
            throw new IOException("spilled content of " + spilledBytes + " bytes exceeds the maximum array size");
        }
        try (InputStream in = Files.newInputStream(spillFile)) {
            byte[] content = in.readNBytes((int) spilledBytes);
            if (content.length != spilledBytes) {
                throw new IOException("spill file " + spillFile + " is truncated: expected "
                        + spilledBytes + " bytes but found " + content.length);
            }
            return content;
        }
    }

    private void closeSpillChannel() throws IOException {
        if (spillChannel != null) {
            try {
                spillChannel.close();
            } finally {
                spillChannel = null;
            }
        }
    }

    private void deleteSpillFile(Throwable pending) {
        try {
            closeSpillChannel();
            Files.deleteIfExists(spillFile);
        } catch (IOException e) {
            pending.addSuppressed(e);
        } finally {
            spillFile = null;
            spilledBytes = 0;
        }
    }

    private void enterDegradedMode(String reason, IOException cause) {
        if (!degraded) {
            degraded = true;
            log.warn("Keeping {} bytes of sheet data in memory, {}", buffer.size(), reason, cause);
        } else {
            log.debug("Still keeping {} bytes of sheet data in memory, {}: {}", buffer.size(), reason, cause.toString());
        }
    }
}
