package com.example.h3csv.processing;

import com.example.h3csv.csv.CsvParserStrategy;
import com.example.h3csv.csv.GeoRecord;
import com.example.h3csv.csv.RecordReader;
import com.example.h3csv.geo.GeographicCoordinateValidator;
import com.example.h3csv.geo.IndexGenerationException;
import com.example.h3csv.geo.IndexGenerator;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamingProcessorTest {

    private static final IndexGenerator FAKE_GENERATOR = (lat, lng, res) -> {
        if (lat == 13.0) {
            throw new IndexGenerationException("unlucky latitude");
        }
        return "cell:" + res + ":" + lat + ":" + lng;
    };

    private final StreamingProcessor processor =
            new StreamingProcessor(new GeographicCoordinateValidator(), FAKE_GENERATOR);

    private static RecordReader reader(String csv, boolean headers, String lat, String lng) throws Exception {
        return new RecordReader(new StringReader(csv), CsvParserStrategy.create("univocity", ',', '"'),
                headers, lat, lng);
    }

    @Test
    void mixedFileKeepsEveryReadableRowInOrder() throws Exception {
        String csv = "name,latitude,longitude\n"
                + "NYC,40.7128,-74.0060\n"
                + "Bad,91.0,0.0\n"
                + "Short,1\n"
                + "Empty,,5\n"
                + "Text,abc,5\n"
                + "Unlucky,13.0,5\n"
                + "London,51.5074,-0.1278\n";
        List<GeoRecord> sunk = new ArrayList<>();

        ProcessingTally tally;
        try (RecordReader r = reader(csv, true, "latitude", "longitude")) {
            tally = processor.process(r, 7, sunk::add, ProcessingDiagnostics.NONE);
        }

        assertThat(sunk).extracting(rec -> rec.getOriginalFields().get(0))
                .containsExactly("NYC", "Bad", "Empty", "Text", "Unlucky", "London");
        assertThat(sunk).extracting(GeoRecord::isValid)
                .containsExactly(true, false, false, false, false, true);
        assertThat(sunk).extracting(GeoRecord::getDerivedIndex)
                .containsExactly("cell:7:40.7128:-74.006", "", "", "", "", "cell:7:51.5074:-0.1278");

        assertThat(tally.getTotalRecords()).isEqualTo(6);
        assertThat(tally.getValidRecords()).isEqualTo(2);
        assertThat(tally.getInvalidRecords()).isEqualTo(4);
        assertThat(tally.getMalformedRows()).isEqualTo(1);
        assertThat(tally.getErrorCount()).isEqualTo(5);
    }

    @Test
    void scenarioTwoRowsOneOutOfRange() throws Exception {
        List<GeoRecord> sunk = new ArrayList<>();
        String csv = "name,latitude,longitude\nNYC,40.7128,-74.0060\nBad,91.0,0.0\n";

        ProcessingTally tally;
        try (RecordReader r = reader(csv, true, "latitude", "longitude")) {
            tally = processor.process(r, 8, sunk::add, ProcessingDiagnostics.NONE);
        }

        assertThat(tally.getTotalRecords()).isEqualTo(2);
        assertThat(tally.getValidRecords()).isEqualTo(1);
        assertThat(tally.getInvalidRecords()).isEqualTo(1);
        assertThat(sunk.get(1).getDerivedIndex()).isEmpty();
    }

    @Test
    void allRowsMalformedProducesNothing() throws Exception {
        List<GeoRecord> sunk = new ArrayList<>();

        ProcessingTally tally;
        try (RecordReader r = reader("1\n2\n3\n", false, "0", "1")) {
            tally = processor.process(r, 8, sunk::add, ProcessingDiagnostics.NONE);
        }

        assertThat(sunk).isEmpty();
        assertThat(tally.getTotalRecords()).isZero();
        assertThat(tally.getMalformedRows()).isEqualTo(3);
        assertThat(tally.getErrorCount()).isEqualTo(3);
    }

    @Test
    void diagnosticsSeeEveryOutcomeWithLineNumbers() throws Exception {
        String csv = "lat,lng\n1,2\nx\n95,0\n,1\n13.0,1\n";
        RecordingDiagnostics diagnostics = new RecordingDiagnostics();

        try (RecordReader r = reader(csv, true, "lat", "lng")) {
            processor.process(r, 3, rec -> { }, diagnostics);
        }

        assertThat(diagnostics.events).containsExactly(
                "INDEXED@2", "MALFORMED@3", "OUT_OF_RANGE@4", "UNPARSEABLE@5", "GENERATION_FAILED@6");
        assertThat(diagnostics.completed.getTotalRecords()).isEqualTo(4);
    }

    @Test
    void diagnosticsDoNotChangeCounts() throws Exception {
        String csv = "lat,lng\n1,2\nx\n95,0\n";
        ProcessingTally quiet;
        ProcessingTally noisy;
        try (RecordReader r = reader(csv, true, "lat", "lng")) {
            quiet = processor.process(r, 3, rec -> { }, ProcessingDiagnostics.NONE);
        }
        try (RecordReader r = reader(csv, true, "lat", "lng")) {
            noisy = processor.process(r, 3, rec -> { }, new LoggingDiagnostics(true));
        }

        assertThat(noisy).isEqualTo(quiet);
    }

    @Test
    void sinkFailureStopsTheStream() throws Exception {
        String csv = "lat,lng\n1,1\n2,2\n3,3\n";
        List<GeoRecord> sunk = new ArrayList<>();
        RecordSink failingOnSecond = rec -> {
            if (sunk.size() == 1) {
                throw new IOException("disk full");
            }
            sunk.add(rec);
        };

        try (RecordReader r = reader(csv, true, "lat", "lng")) {
            assertThatThrownBy(() -> processor.process(r, 5, failingOnSecond, ProcessingDiagnostics.NONE))
                    .isInstanceOfSatisfying(RecordSinkException.class,
                            e -> assertThat(e.getLineNumber()).isEqualTo(3))
                    .hasMessageContaining("disk full");

            // the third row is still unread
            assertThat(r.nextRecord().getOriginalFields()).containsExactly("3", "3");
        }
        assertThat(sunk).hasSize(1);
    }

    @Test
    void sameCoordinatesGiveSameIndex() throws Exception {
        List<GeoRecord> sunk = new ArrayList<>();
        try (RecordReader r = reader("lat,lng\n10.5,20.5\n10.5,20.5\n", true, "lat", "lng")) {
            processor.process(r, 9, sunk::add, ProcessingDiagnostics.NONE);
        }

        assertThat(sunk.get(0).getDerivedIndex()).isEqualTo(sunk.get(1).getDerivedIndex());
    }

    @Test
    void emptyIndexFromGeneratorCountsAsFailure() throws Exception {
        StreamingProcessor blank = new StreamingProcessor(new GeographicCoordinateValidator(), (lat, lng, res) -> "");
        List<GeoRecord> sunk = new ArrayList<>();

        ProcessingTally tally;
        try (RecordReader r = reader("lat,lng\n1,2\n", true, "lat", "lng")) {
            tally = blank.process(r, 9, sunk::add, ProcessingDiagnostics.NONE);
        }

        assertThat(tally.getValidRecords()).isZero();
        assertThat(sunk.get(0).isValid()).isFalse();
    }

    @Test
    void reportsProgressEveryHundredThousandRecords() throws Exception {
        String csv = "lat,lng\n" + java.util.stream.IntStream.range(0, 100_001)
                .mapToObj(i -> "1,2")
                .collect(Collectors.joining("\n"));
        RecordingDiagnostics diagnostics = new RecordingDiagnostics();

        try (RecordReader r = reader(csv, true, "lat", "lng")) {
            processor.process(r, 0, rec -> { }, diagnostics);
        }

        assertThat(diagnostics.progress).containsExactly(100_000L);
    }

    private static final class RecordingDiagnostics implements ProcessingDiagnostics {
        final List<String> events = new ArrayList<>();
        final List<Long> progress = new ArrayList<>();
        ProcessingTally completed;

        @Override
        public void onOutcome(RecordOutcome outcome, long lineNumber, String detail) {
            if (events.size() < 100) {
                events.add(outcome + "@" + lineNumber);
            }
        }

        @Override
        public void onProgress(long forwarded) {
            progress.add(forwarded);
        }

        @Override
        public void onComplete(ProcessingTally tally) {
            completed = tally;
        }
    }
}
