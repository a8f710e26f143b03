package com.example.h3csv.csv;

import com.example.h3csv.io.MappedFileOutputStream;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes records back out as delimited text with the {@value #INDEX_COLUMN} column appended.
 * Original fields are copied verbatim and in order; the index is the last field, empty for
 * invalid records.
 */
@Slf4j
public class RecordWriter implements Closeable, Flushable {

    public static final String INDEX_COLUMN = "h3_index";

    private static final int BUFFER_SIZE = 64 * 1024;

    private final CsvParserStrategy.RowPrinter printer;
    private long rowsWritten;
    private boolean closed;

    /**
     * @param headers input header names; written (plus {@value #INDEX_COLUMN}) only when not {@code null}
     */
    public RecordWriter(Writer output, CsvParserStrategy strategy, List<String> headers) throws IOException {
        this.printer = strategy.printer(output);
        if (headers != null) {
            printer.printRow(outputHeader(headers));
        }
    }

    /**
     * Opens {@code path} for writing. Refuses an existing file unless {@code overwrite} is set;
     * the check runs before anything is created or truncated.
     */
    public static RecordWriter open(Path path, boolean overwrite, Charset charset, CsvParserStrategy strategy,
                                    List<String> headers, long chunkSize) throws IOException, OutputExistsException {
        if (Files.exists(path) && !overwrite) {
            throw new OutputExistsException(path);
        }
        MappedFileOutputStream out = new MappedFileOutputStream(path, chunkSize);
        try {
            Writer writer = new BufferedWriter(new OutputStreamWriter(out, charset), BUFFER_SIZE);
            return new RecordWriter(writer, strategy, headers);
        } catch (IOException | RuntimeException e) {
            out.close();
            throw e;
        }
    }

    public static String[] outputHeader(List<String> headers) {
        String[] out = headers.toArray(new String[headers.size() + 1]);
        out[headers.size()] = INDEX_COLUMN;
        return out;
    }

    public void write(GeoRecord record) throws IOException {
        if (closed) {
            throw new IOException("writer is closed");
        }
        List<String> fields = record.getOriginalFields();
        String[] row = fields.toArray(new String[fields.size() + 1]);
        row[fields.size()] = record.isValid() ? record.getDerivedIndex() : "";
        printer.printRow(row);
        rowsWritten++;
    }

    public long getRowsWritten() {
        return rowsWritten;
    }

    /**
     * Pushes buffered rows down to storage.
     */
    @Override
    public void flush() throws IOException {
        printer.flush();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        printer.close();
        log.debug("Closed writer after {} rows", rowsWritten);
    }
}
