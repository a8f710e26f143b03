package com.example.h3csv.csv;

import com.example.h3csv.JobSetupException;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reads {@link GeoRecord}s from a delimited stream, one row per {@link #nextRecord()} call.
 *
 * <p>The header (when expected) is consumed and the coordinate columns are resolved in
 * the constructor, so a column mismatch fails before any data row is read. The sequence
 * is forward-only; reading again means opening a new reader.</p>
 *
 * <p>Line numbers are 1-based record positions in the source, the header counting as line 1.</p>
 */
@Slf4j
public class RecordReader implements Closeable {

    private final Reader input;
    private final CsvParserStrategy.RowSource rows;
    private final List<String> headers;
    private final ColumnMapping mapping;

    private long lineNumber;
    private boolean exhausted;
    private boolean closed;

    public RecordReader(Reader input, CsvParserStrategy strategy, boolean hasHeaders,
                        String latitudeSpec, String longitudeSpec) throws IOException, JobSetupException {
        this.input = input;
        try {
            this.rows = strategy.open(input);
        } catch (IOException | RuntimeException e) {
            try {
                input.close();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        try {
            if (hasHeaders) {
                String[] header = rows.nextRow();
                if (header == null) {
                    throw new JobSetupException("failed to read headers: input is empty");
                }
                lineNumber++;
                this.headers = Collections.unmodifiableList(Arrays.asList(header));
            } else {
                this.headers = null;
            }
            this.mapping = ColumnResolver.resolve(headers, latitudeSpec, longitudeSpec);
        } catch (IOException | JobSetupException | RuntimeException e) {
            closeQuietly(e);
            throw e;
        }
        log.debug("Resolved coordinate columns: latitude={}, longitude={}",
                mapping.getLatitudeIndex(), mapping.getLongitudeIndex());
    }

    /**
     * @return the next record, or {@code null} once the input is exhausted
     * @throws MalformedRowException when the row cannot reach both coordinate columns or the
     *                               parser rejected it; the reader stays usable
     */
    public GeoRecord nextRecord() throws IOException, MalformedRowException {
        if (exhausted || closed) {
            return null;
        }
        String[] row;
        try {
            row = rows.nextRow();
        } catch (RowSyntaxException e) {
            lineNumber++;
            throw new MalformedRowException(lineNumber, e);
        }
        if (row == null) {
            exhausted = true;
            return null;
        }
        lineNumber++;
        int required = mapping.requiredFieldCount();
        if (row.length < required) {
            throw new MalformedRowException(lineNumber, required, row.length);
        }

        GeoRecord record = new GeoRecord(row, lineNumber);
        String latText = row[mapping.getLatitudeIndex()].trim();
        String lngText = row[mapping.getLongitudeIndex()].trim();
        if (latText.isEmpty() || lngText.isEmpty()) {
            return record;
        }
        Double lat = parseCoordinate(latText);
        Double lng = parseCoordinate(lngText);
        if (lat != null && lng != null) {
            record.setCoordinates(lat, lng);
        }
        return record;
    }

    /**
     * Decimal or scientific notation. Java's float/double suffixes ({@code 1.5d}) are not coordinates.
     */
    static Double parseCoordinate(String text) {
        char last = text.charAt(text.length() - 1);
        if (last == 'd' || last == 'D' || last == 'f' || last == 'F') {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Header names as read, or {@code null} when the input has no header row. */
    public List<String> getHeaders() {
        return headers;
    }

    public ColumnMapping getColumnMapping() {
        return mapping;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            rows.close();
        } finally {
            input.close();
        }
    }

    private void closeQuietly(Exception primary) {
        try {
            close();
        } catch (IOException suppressed) {
            primary.addSuppressed(suppressed);
        }
    }
}
