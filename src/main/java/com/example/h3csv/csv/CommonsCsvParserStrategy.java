package com.example.h3csv.csv;

import lombok.Data;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Iterator;

/**
 * Apache Commons CSV implementation (alternative to uniVocity).
 *
 * <p>Each record's text is cut from the stream first and parsed on its own, so a record
 * Commons CSV rejects (e.g. {@code "40.7"x}) is reported as a {@link RowSyntaxException}
 * and the rows after it are still read.</p>
 */
public class CommonsCsvParserStrategy implements CsvParserStrategy {

    @Data
    public static class Config {
        private char delimiter = ',';
        private char quoteChar = '"';
    }

    private final Config cfg;

    public CommonsCsvParserStrategy(Config cfg) {
        this.cfg = cfg;
    }

    CSVFormat format() {
        return CSVFormat.DEFAULT
                .withDelimiter(cfg.delimiter)
                .withQuote(cfg.quoteChar)
                .withRecordSeparator('\n')
                .withIgnoreEmptyLines(true);
    }

    @Override
    public RowSource open(Reader input) {
        return new Source(new RecordTextReader(input, cfg.delimiter, cfg.quoteChar), format());
    }

    // CSVPrinter's minimal quoting also quotes '#'-leading and empty leading fields
    @Override
    public RowPrinter printer(Writer output) {
        return new DelimitedRowPrinter(output, cfg.delimiter, cfg.quoteChar);
    }

    private static final class Source implements RowSource {
        private final RecordTextReader records;
        private final CSVFormat format;

        Source(RecordTextReader records, CSVFormat format) {
            this.records = records;
            this.format = format;
        }

        @Override
        public String[] nextRow() throws IOException {
            String text = records.next();
            if (text == null) {
                return null;
            }
            try (CSVParser parser = CSVParser.parse(text, format)) {
                Iterator<CSVRecord> it = parser.iterator();
                if (!it.hasNext()) {
                    return new String[] {""};
                }
                CSVRecord rec = it.next();
                String[] row = new String[rec.size()];
                for (int i = 0; i < row.length; i++) {
                    row[i] = rec.get(i);
                }
                return row;
            } catch (IOException | UncheckedIOException | IllegalStateException e) {
                throw new RowSyntaxException("commons-csv could not parse row: " + rootMessage(e), e);
            }
        }

        private static String rootMessage(Throwable e) {
            Throwable t = e;
            while (t.getCause() != null && t.getCause() != t) {
                t = t.getCause();
            }
            return t.getMessage();
        }

        @Override
        public void close() throws IOException {
            records.close();
        }
    }
}
