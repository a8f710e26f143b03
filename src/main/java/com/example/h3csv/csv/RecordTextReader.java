package com.example.h3csv.csv;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;

/**
 * Cuts a character stream into the raw text of one record at a time, keeping line breaks
 * that sit inside quoted fields. Empty lines are skipped. The text is returned without its
 * terminator, ready to be handed to a parser on its own, so a bad record never leaves the
 * parser out of step with the stream.
 *
 * <p>A quote opens a quoted field only at the start of a field; a doubled quote inside one
 * is an escaped quote.</p>
 */
final class RecordTextReader implements Closeable {

    private final BufferedReader in;
    private final char delimiter;
    private final char quoteChar;

    RecordTextReader(Reader input, char delimiter, char quoteChar) {
        this.in = input instanceof BufferedReader ? (BufferedReader) input : new BufferedReader(input);
        this.delimiter = delimiter;
        this.quoteChar = quoteChar;
    }

    /** Raw text of the next non-empty record, or {@code null} at end of input. */
    String next() throws IOException {
        StringBuilder record = new StringBuilder();
        boolean quoted = false;
        boolean fieldStart = true;
        int c;
        while ((c = in.read()) != -1) {
            char ch = (char) c;
            if (quoted) {
                record.append(ch);
                if (ch == quoteChar) {
                    in.mark(1);
                    if (in.read() == quoteChar) {
                        record.append(quoteChar);
                    } else {
                        in.reset();
                        quoted = false;
                    }
                }
                continue;
            }
            if (ch == '\n' || ch == '\r') {
                if (ch == '\r') {
                    in.mark(1);
                    if (in.read() != '\n') {
                        in.reset();
                    }
                }
                if (record.length() > 0) {
                    return record.toString();
                }
                continue;
            }
            if (ch == quoteChar && fieldStart) {
                quoted = true;
            }
            fieldStart = ch == delimiter;
            record.append(ch);
        }
        return record.length() > 0 ? record.toString() : null;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
