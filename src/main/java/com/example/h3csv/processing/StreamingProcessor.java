package com.example.h3csv.processing;

import com.example.h3csv.csv.ColumnMapping;
import com.example.h3csv.csv.GeoRecord;
import com.example.h3csv.csv.MalformedRowException;
import com.example.h3csv.csv.RecordReader;
import com.example.h3csv.geo.CoordinateValidator;
import com.example.h3csv.geo.IndexGenerationException;
import com.example.h3csv.geo.IndexGenerator;
import com.example.h3csv.geo.InvalidCoordinateException;

import java.io.IOException;
import java.util.List;

/**
 * Pulls records from a {@link RecordReader} one at a time, validates them, attaches the
 * index and pushes each one to a {@link RecordSink}.
 *
 * <p>Bad rows never stop the stream. A malformed row is counted and dropped; a record
 * whose coordinates are unusable is still forwarded, with an empty index. Only a sink
 * failure or an I/O failure of the reader ends processing early.</p>
 *
 * <p>Instances hold no per-job state and may be shared.</p>
 */
public class StreamingProcessor {

    public static final long PROGRESS_INTERVAL = 100_000;

    private final CoordinateValidator validator;
    private final IndexGenerator generator;

    public StreamingProcessor(CoordinateValidator validator, IndexGenerator generator) {
        this.validator = validator;
        this.generator = generator;
    }

    public ProcessingTally process(RecordReader reader, int resolution, RecordSink sink,
                                   ProcessingDiagnostics diagnostics) throws IOException, RecordSinkException {
        ColumnMapping mapping = reader.getColumnMapping();
        long total = 0;
        long valid = 0;
        long malformed = 0;
        long errors = 0;

        while (true) {
            GeoRecord record;
            try {
                record = reader.nextRecord();
            } catch (MalformedRowException e) {
                malformed++;
                errors++;
                diagnostics.onOutcome(RecordOutcome.MALFORMED, e.getLineNumber(), e.getMessage());
                continue;
            }
            if (record == null) {
                break;
            }

            RecordOutcome outcome = apply(record, mapping, resolution, diagnostics);
            total++;
            if (outcome.isValid()) {
                valid++;
            } else {
                errors++;
            }

            try {
                sink.accept(record);
            } catch (IOException | RuntimeException e) {
                throw new RecordSinkException(record.getLineNumber(), e);
            }
            if (total % PROGRESS_INTERVAL == 0) {
                diagnostics.onProgress(total);
            }
        }

        ProcessingTally tally = new ProcessingTally(total, valid, malformed, errors);
        diagnostics.onComplete(tally);
        return tally;
    }

    /**
     * Runs validation and index generation on a freshly read record and leaves it
     * either indexed or invalid.
     */
    RecordOutcome apply(GeoRecord record, ColumnMapping mapping, int resolution, ProcessingDiagnostics diagnostics) {
        long line = record.getLineNumber();
        if (!record.isValid()) {
            record.markInvalid();
            diagnostics.onOutcome(RecordOutcome.UNPARSEABLE, line, describeCoordinates(record, mapping));
            return RecordOutcome.UNPARSEABLE;
        }
        try {
            validator.validate(record.getLatitude(), record.getLongitude());
        } catch (InvalidCoordinateException e) {
            record.markInvalid();
            diagnostics.onOutcome(RecordOutcome.OUT_OF_RANGE, line, e.getMessage());
            return RecordOutcome.OUT_OF_RANGE;
        }
        try {
            String index = generator.generate(record.getLatitude(), record.getLongitude(), resolution);
            if (index == null || index.isEmpty()) {
                throw new IndexGenerationException("generator returned no index");
            }
            record.markIndexed(index);
            diagnostics.onOutcome(RecordOutcome.INDEXED, line, index);
            return RecordOutcome.INDEXED;
        } catch (IndexGenerationException e) {
            record.markInvalid();
            diagnostics.onOutcome(RecordOutcome.GENERATION_FAILED, line, e.getMessage());
            return RecordOutcome.GENERATION_FAILED;
        }
    }

    private static String describeCoordinates(GeoRecord record, ColumnMapping mapping) {
        List<String> fields = record.getOriginalFields();
        return "latitude='" + fields.get(mapping.getLatitudeIndex())
                + "', longitude='" + fields.get(mapping.getLongitudeIndex()) + "'";
    }
}
