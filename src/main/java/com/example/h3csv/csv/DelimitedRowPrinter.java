package com.example.h3csv.csv;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes rows field for field. A field is quoted only when it holds the delimiter, the
 * quote character or a line break, so anything read from a well-formed file goes back out
 * as it came in. Rows end with {@code \n}.
 */
final class DelimitedRowPrinter implements CsvParserStrategy.RowPrinter {

    private final Writer writer;
    private final char delimiter;
    private final char quoteChar;

    DelimitedRowPrinter(Writer writer, char delimiter, char quoteChar) {
        this.writer = writer;
        this.delimiter = delimiter;
        this.quoteChar = quoteChar;
    }

    @Override
    public void printRow(String[] row) throws IOException {
        for (int i = 0; i < row.length; i++) {
            if (i > 0) writer.write(delimiter);
            String field = row[i];
            if (field == null) field = "";
            if (needsQuote(field)) {
                writer.write(quoteChar);
                writer.write(field.replace(String.valueOf(quoteChar), String.valueOf(quoteChar) + quoteChar));
                writer.write(quoteChar);
            } else {
                writer.write(field);
            }
        }
        writer.write('\n');
    }

    private boolean needsQuote(String field) {
        return field.indexOf(delimiter) >= 0
                || field.indexOf(quoteChar) >= 0
                || field.indexOf('\n') >= 0
                || field.indexOf('\r') >= 0;
    }

    @Override
    public void flush() throws IOException {
        writer.flush();
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
