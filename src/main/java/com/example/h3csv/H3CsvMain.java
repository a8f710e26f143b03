package com.example.h3csv;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.example.h3csv.geo.GeographicCoordinateValidator;
import com.example.h3csv.geo.H3IndexGenerator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Command line entry point.
 *
 * Example usage:
 * java -jar csv-h3-indexer.jar data.csv -o data_h3.csv -r 9 --lat-column lat --lng-column lon
 */
@Slf4j
@Command(
        name = "h3csv",
        mixinStandardHelpOptions = true,
        version = "csv-h3-indexer 1.0",
        description = {
                "Adds an H3 index column to a delimited file holding latitude/longitude columns.",
                "All original columns are kept in order; rows with unusable coordinates get an empty h3_index."
        },
        subcommands = {
                ResolutionsCommand.class,
                EncodingsCommand.class,
                SampleDataCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class H3CsvMain implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "INPUT", description = "Input CSV file")
    private File inputFile;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE",
            description = "Output file (default: <input>" + JobConfig.OUTPUT_SUFFIX + ".<ext>)")
    private File outputFile;

    @Option(names = "--lat-column", defaultValue = "latitude",
            description = "Name or zero-based index of the latitude column (default: ${DEFAULT-VALUE})")
    private String latColumn;

    @Option(names = "--lng-column", defaultValue = "longitude",
            description = "Name or zero-based index of the longitude column (default: ${DEFAULT-VALUE})")
    private String lngColumn;

    @Option(names = {"-r", "--resolution"}, defaultValue = "8",
            description = "H3 resolution 0-15, higher is finer (default: ${DEFAULT-VALUE}, street level)")
    private int resolution;

    @Option(names = "--no-headers", description = "Input has no header row; columns are given as indices")
    private boolean noHeaders;

    @Option(names = {"-d", "--delimiter"}, defaultValue = ",",
            description = "Field delimiter, a single character or \\t (default: '${DEFAULT-VALUE}')")
    private String delimiter;

    @Option(names = "--quote", defaultValue = "\"", description = "Quote character (default: ${DEFAULT-VALUE})")
    private char quoteChar;

    @Option(names = "--overwrite", description = "Replace the output file if it exists")
    private boolean overwrite;

    @Option(names = {"-v", "--verbose"}, description = "Log every skipped or invalid row")
    private boolean verbose;

    @Option(names = "--parser", defaultValue = "univocity",
            description = "CSV implementation: univocity or commons (default: ${DEFAULT-VALUE})")
    private String parser;

    @Option(names = {"-e", "--encoding"}, defaultValue = "UTF-8",
            description = "Input encoding, or 'auto' to detect it (default: ${DEFAULT-VALUE})")
    private String encoding;

    @Option(names = "--chunk-size", defaultValue = "67108864",
            description = "Bytes per memory-mapped window (default: ${DEFAULT-VALUE})")
    private long chunkSize;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new H3CsvMain()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (inputFile == null) {
            spec.commandLine().usage(err);
            return EXIT_USAGE;
        }

        JobConfig config;
        try {
            config = toConfig();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (verbose) {
            enableDebugLogging();
        }
        log.debug("Options: {}", config);

        H3IndexGenerator generator;
        try {
            generator = H3IndexGenerator.create();
        } catch (IOException e) {
            log.error("Failed to load the H3 native library: {}", e.getMessage(), e);
            err.println("Error: cannot load H3 library: " + e.getMessage());
            return EXIT_FAILURE;
        }

        JobResult result;
        try {
            result = new GeoIndexJob(config, new GeographicCoordinateValidator(), generator).run();
        } catch (JobSetupException e) {
            log.error("Setup failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (GeoIndexException e) {
            log.error("Processing failed: {}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        printSummary(out, result);
        return EXIT_OK;
    }

    JobConfig toConfig() {
        JobConfig config = new JobConfig();
        config.setInputFile(inputFile);
        config.setOutputFile(outputFile);
        config.setLatColumn(latColumn);
        config.setLngColumn(lngColumn);
        config.setResolution(resolution);
        config.setHasHeaders(!noHeaders);
        config.setDelimiter(parseDelimiter(delimiter));
        config.setQuoteChar(quoteChar);
        config.setOverwrite(overwrite);
        config.setVerbose(verbose);
        config.setParser(parser);
        config.setEncoding(encoding);
        config.setChunkSize(chunkSize);
        return config;
    }

    /**
     * Accepts one character, or {@code \t} / {@code tab} for a tab.
     */
    static char parseDelimiter(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("delimiter cannot be empty");
        }
        if (text.equals("\\t") || text.equalsIgnoreCase("tab")) {
            return '\t';
        }
        if (text.length() != 1) {
            throw new IllegalArgumentException("delimiter must be a single character, got: " + text);
        }
        return text.charAt(0);
    }

    static void printSummary(PrintWriter out, JobResult result) {
        out.println("Processing completed successfully!");
        out.println("Output file: " + result.getOutputFile());
        out.println("Total records: " + result.getTotalRecords());
        out.println("Valid records: " + result.getValidRecords());
        out.println("Invalid records: " + result.getInvalidRecords());
        if (result.getMalformedRows() > 0) {
            out.println("Malformed rows skipped: " + result.getMalformedRows());
        }
        out.printf("Processing time: %.3fs (%d records/s)%n",
                result.getDuration().toMillis() / 1000.0, result.recordsPerSecond());
        if (result.getInvalidRecords() > 0) {
            out.println();
            out.println("Warning: " + result.getInvalidRecords()
                    + " records have an empty h3_index due to invalid coordinates.");
            out.println("Use --verbose to see the reason for each one.");
        }
        out.flush();
    }

    private static void enableDebugLogging() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            ((LoggerContext) factory).getLogger("com.example.h3csv").setLevel(Level.DEBUG);
        }
    }
}
