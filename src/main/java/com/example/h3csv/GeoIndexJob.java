package com.example.h3csv;

import com.example.h3csv.csv.CsvParserStrategy;
import com.example.h3csv.csv.RecordReader;
import com.example.h3csv.csv.RecordWriter;
import com.example.h3csv.geo.CoordinateValidator;
import com.example.h3csv.geo.IndexGenerator;
import com.example.h3csv.io.MappedFileInputStream;
import com.example.h3csv.processing.LoggingDiagnostics;
import com.example.h3csv.processing.ProcessingDiagnostics;
import com.example.h3csv.processing.ProcessingTally;
import com.example.h3csv.processing.StreamingProcessor;
import com.example.h3csv.util.CharsetResolver;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Runs one file through reader, processor and writer.
 *
 * <p>Setup (configuration, resolution range, encoding, header and column resolution,
 * output existence) completes before the first data row is read; any failure there
 * leaves no output behind. A job owns its handles and counters and shares nothing
 * with other jobs.</p>
 */
@Slf4j
public class GeoIndexJob {

    private final JobConfig config;
    private final StreamingProcessor processor;
    private final IndexGenerator generator;
    private final ProcessingDiagnostics diagnostics;

    public GeoIndexJob(JobConfig config, CoordinateValidator validator, IndexGenerator generator) {
        this(config, validator, generator, new LoggingDiagnostics(config.isVerbose()));
    }

    public GeoIndexJob(JobConfig config, CoordinateValidator validator, IndexGenerator generator,
                       ProcessingDiagnostics diagnostics) {
        this.config = config;
        this.generator = generator;
        this.processor = new StreamingProcessor(validator, generator);
        this.diagnostics = diagnostics;
    }

    public JobResult run() throws GeoIndexException {
        long start = System.nanoTime();

        config.validate();
        try {
            generator.validateResolution(config.getResolution());
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("resolution", e.getMessage(), e);
        }

        Path input = config.getInputFile().toPath();
        Path output = config.getOutputFile().toPath();
        log.info("Input file: {}", input);
        log.info("Output file: {}", output);
        log.info("H3 resolution: {} ({})", config.getResolution(), config.getResolutionLevel().describe());

        Charset charset;
        try {
            charset = CharsetResolver.forInput(config.getEncoding(), input);
        } catch (IOException e) {
            throw new InvalidConfigurationException("input", "cannot read input file: " + e.getMessage(), e);
        }
        CsvParserStrategy strategy = CsvParserStrategy.create(config.getParser(), config.getDelimiter(),
                config.getQuoteChar());

        RecordReader reader = openReader(input, charset, strategy);
        try (reader) {
            ProcessingTally tally;
            try (RecordWriter writer = openWriter(output, charset, strategy, reader)) {
                try {
                    tally = processor.process(reader, config.getResolution(), writer::write, diagnostics);
                } catch (IOException e) {
                    // sink failures arrive as RecordSinkException, so this is the input side
                    throw new GeoIndexException("failed reading " + input + ": " + e.getMessage(), e);
                }
                writer.flush();
            } catch (IOException e) {
                throw new GeoIndexException("failed writing " + output + ": " + e.getMessage(), e);
            }
            JobResult result = JobResult.of(tally, Duration.ofNanos(System.nanoTime() - start), config.getOutputFile());
            log.info("Completed. Records: {}, valid: {}, invalid: {}, time(s): {}, RPS: {}",
                    result.getTotalRecords(), result.getValidRecords(), result.getInvalidRecords(),
                    result.getDuration().toMillis() / 1000.0, result.recordsPerSecond());
            return result;
        } catch (IOException e) {
            throw new GeoIndexException("failed closing " + input + ": " + e.getMessage(), e);
        }
    }

    private RecordReader openReader(Path input, Charset charset, CsvParserStrategy strategy) throws JobSetupException {
        MappedFileInputStream in;
        try {
            in = new MappedFileInputStream(input, config.getChunkSize());
        } catch (IOException e) {
            throw new InvalidConfigurationException("input", "cannot open input file: " + e.getMessage(), e);
        }
        try {
            return new RecordReader(new InputStreamReader(in, charset), strategy, config.isHasHeaders(),
                    config.getLatColumn(), config.getLngColumn());
        } catch (IOException e) {
            throw new JobSetupException("failed reading header of " + input + ": " + e.getMessage(), e);
        }
    }

    private RecordWriter openWriter(Path output, Charset charset, CsvParserStrategy strategy, RecordReader reader)
            throws IOException, JobSetupException {
        log.debug("Latitude column index {}, longitude column index {}",
                reader.getColumnMapping().getLatitudeIndex(), reader.getColumnMapping().getLongitudeIndex());
        return RecordWriter.open(output, config.isOverwrite(), charset, strategy, reader.getHeaders(),
                config.getChunkSize());
    }
}
