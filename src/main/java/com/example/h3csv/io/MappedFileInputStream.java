package com.example.h3csv.io;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Reads a file through consecutive read-only mapped windows of at most {@code chunkSize}
 * bytes, so only one window is resident at a time however large the file is.
 */
@Slf4j
public class MappedFileInputStream extends InputStream {

    private final FileChannel channel;
    private final long fileSize;
    private final long chunkSize;
    private long position = 0;

    private MappedByteBuffer mapped;
    private boolean closed;

    public MappedFileInputStream(Path file, long chunkSize) throws IOException {
        Objects.requireNonNull(file, "file");
        if (chunkSize <= 0 || chunkSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("chunkSize must be in (0, " + Integer.MAX_VALUE + "]: " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.channel = FileChannel.open(file, StandardOpenOption.READ);
        this.fileSize = channel.size();
        try {
            mapNext();
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }

    private void mapNext() throws IOException {
        MappedBuffers.release(mapped);
        mapped = null;
        if (position >= fileSize) {
            return;
        }
        long size = Math.min(chunkSize, fileSize - position);
        mapped = channel.map(FileChannel.MapMode.READ_ONLY, position, size);
        log.debug("Mapped input window: start={}, size={}", position, size);
        position += size;
    }

    @Override
    public int read() throws IOException {
        ensureOpen();
        while (mapped != null) {
            if (mapped.hasRemaining()) {
                return mapped.get() & 0xFF;
            }
            mapNext();
        }
        return -1;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        ensureOpen();
        if (len == 0) {
            return 0;
        }
        int totalRead = 0;
        // keep copying across windows until the request is satisfied or EOF
        while (len > 0 && mapped != null) {
            if (!mapped.hasRemaining()) {
                mapNext();
                continue;
            }
            int toRead = Math.min(len, mapped.remaining());
            mapped.get(b, off, toRead);
            off += toRead;
            len -= toRead;
            totalRead += toRead;
        }
        return totalRead == 0 ? -1 : totalRead;
    }

    @Override
    public int available() {
        return mapped == null ? 0 : mapped.remaining();
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            MappedBuffers.release(mapped);
            mapped = null;
        } finally {
            channel.close();
        }
    }
}
