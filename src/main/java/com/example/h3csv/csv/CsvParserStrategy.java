package com.example.h3csv.csv;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.Locale;

/**
 * CSV parser strategy to allow switching between uniVocity and Commons CSV.
 * Both sides of a job (reading and printing) use the same strategy so the
 * output dialect matches the input.
 */
public interface CsvParserStrategy {

    String UNIVOCITY = "univocity";
    String COMMONS = "commons";

    RowSource open(Reader input) throws IOException;

    RowPrinter printer(Writer output) throws IOException;

    /**
     * Forward-only sequence of raw rows. Fields are never trimmed and never {@code null}.
     */
    interface RowSource extends Closeable {

        /** The next row, or {@code null} at end of input. */
        String[] nextRow() throws IOException;
    }

    interface RowPrinter extends Flushable, Closeable {

        void printRow(String[] fields) throws IOException;
    }

    static CsvParserStrategy create(String name, char delimiter, char quoteChar) {
        String key = name == null ? UNIVOCITY : name.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case COMMONS: {
                CommonsCsvParserStrategy.Config cfg = new CommonsCsvParserStrategy.Config();
                cfg.setDelimiter(delimiter);
                cfg.setQuoteChar(quoteChar);
                return new CommonsCsvParserStrategy(cfg);
            }
            case UNIVOCITY: {
                UniVocityCsvParserStrategy.Config cfg = new UniVocityCsvParserStrategy.Config();
                cfg.setDelimiter(delimiter);
                cfg.setQuoteChar(quoteChar);
                return new UniVocityCsvParserStrategy(cfg);
            }
            default:
                throw new IllegalArgumentException("unknown parser '" + name + "', expected "
                        + UNIVOCITY + " or " + COMMONS);
        }
    }
}
