package com.example.h3csv.io;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * OutputStream backed by read-write mapped windows of {@code chunkSize} bytes.
 * The file grows one window at a time and is truncated to the bytes actually
 * written on {@link #close()}. {@link #flush()} forces the current window to storage.
 */
@Slf4j
public class MappedFileOutputStream extends OutputStream {

    private final FileChannel channel;
    private final long chunkSize;

    // absolute file position where the current window starts
    private long windowStart = 0L;
    private MappedByteBuffer mapped;
    private boolean closed;

    public MappedFileOutputStream(Path file, long chunkSize) throws IOException {
        Objects.requireNonNull(file, "file");
        if (chunkSize <= 0 || chunkSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("chunkSize must be in (0, " + Integer.MAX_VALUE + "]: " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.channel = FileChannel.open(file,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE,
                StandardOpenOption.CREATE);
    }

    private void mapNext() throws IOException {
        if (mapped != null) {
            mapped.force();
            windowStart += mapped.position();
            MappedBuffers.release(mapped);
            mapped = null;
        }
        // mapping past the end grows the file, close() trims it back
        mapped = channel.map(FileChannel.MapMode.READ_WRITE, windowStart, chunkSize);
        log.debug("Mapped output window: start={}, size={}", windowStart, chunkSize);
    }

    @Override
    public void write(int b) throws IOException {
        ensureOpen();
        if (mapped == null || !mapped.hasRemaining()) {
            mapNext();
        }
        mapped.put((byte) b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        ensureOpen();
        while (len > 0) {
            if (mapped == null || !mapped.hasRemaining()) {
                mapNext();
            }
            int toWrite = Math.min(mapped.remaining(), len);
            mapped.put(b, off, toWrite);
            off += toWrite;
            len -= toWrite;
        }
    }

    @Override
    public void flush() throws IOException {
        ensureOpen();
        if (mapped != null) {
            mapped.force();
        }
    }

    /** Bytes written so far. */
    public long size() {
        return windowStart + (mapped == null ? 0 : mapped.position());
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
            long finalSize = size();
            if (mapped != null) {
                mapped.force();
                MappedBuffers.release(mapped);
                mapped = null;
            }
            channel.truncate(finalSize);
            channel.force(true);
        } finally {
            channel.close();
        }
    }
}
