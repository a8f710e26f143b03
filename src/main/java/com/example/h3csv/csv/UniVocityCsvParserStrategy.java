package com.example.h3csv.csv;

import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
 * uniVocity parser implementation. Rows are pulled one at a time with
 * {@link CsvParser#parseNext()}; printing is done by hand so fields go out exactly as read.
 *
 * <p>uniVocity stops parsing at its first error, so a {@link TextParsingException} ends
 * the input and surfaces as a plain {@link IOException}.</p>
 */
@Slf4j
public class UniVocityCsvParserStrategy implements CsvParserStrategy {

    @Data
    public static class Config {
        private char delimiter = ',';
        private char quoteChar = '"';
        private boolean skipEmptyLines = true;
        // uniVocity allocates the row array up front and cannot grow it
        private int maxColumns = 65_536;
        private int maxCharsPerColumn = 10_000_000; // safety
    }

    private final Config cfg;

    public UniVocityCsvParserStrategy(Config cfg) {
        this.cfg = cfg;
    }

    @Override
    public RowSource open(Reader input) {
        CsvParserSettings settings = new CsvParserSettings();
        settings.getFormat().setDelimiter(cfg.delimiter);
        settings.getFormat().setQuote(cfg.quoteChar);
        settings.getFormat().setQuoteEscape(cfg.quoteChar);
        // no comment lines: a '#'-leading row is data
        settings.getFormat().setComment('\0');
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setIgnoreLeadingWhitespaces(false);
        settings.setIgnoreTrailingWhitespaces(false);
        settings.setSkipEmptyLines(cfg.skipEmptyLines);
        settings.setNullValue("");
        settings.setEmptyValue("");
        settings.setMaxColumns(cfg.maxColumns);
        settings.setMaxCharsPerColumn(cfg.maxCharsPerColumn);
        settings.setHeaderExtractionEnabled(false);

        CsvParser parser = new CsvParser(settings);
        parser.beginParsing(input);
        return new Source(parser);
    }

    @Override
    public RowPrinter printer(Writer output) {
        return new DelimitedRowPrinter(output, cfg.delimiter, cfg.quoteChar);
    }

    private static final class Source implements RowSource {
        private final CsvParser parser;
        private boolean stopped;

        Source(CsvParser parser) {
            this.parser = parser;
        }

        @Override
        public String[] nextRow() throws IOException {
            if (stopped) {
                return null;
            }
            try {
                String[] row = parser.parseNext();
                if (row == null) {
                    stopped = true;
                }
                return row;
            } catch (TextParsingException e) {
                throw new IOException("uniVocity could not parse line " + e.getLineIndex() + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            if (!stopped) {
                stopped = true;
                parser.stopParsing();
            }
        }
    }
}
