package com.example.h3csv;

import com.example.h3csv.csv.CsvParserStrategy;
import com.example.h3csv.geo.H3Resolution;
import lombok.Data;

import java.io.File;
import java.util.Locale;

/**
 * Options of one indexing job. Filled by the command line, checked by {@link #validate()}
 * before anything is opened.
 */
@Data
public class JobConfig {

    public static final String OUTPUT_SUFFIX = "_with_h3";

    private File inputFile;
    private File outputFile;
    private String latColumn = "latitude";
    private String lngColumn = "longitude";
    private int resolution = H3Resolution.DEFAULT.getLevel();
    private boolean hasHeaders = true;
    private char delimiter = ',';
    private char quoteChar = '"';
    private boolean overwrite = false;
    private boolean verbose = false;
    private String parser = CsvParserStrategy.UNIVOCITY;
    private String encoding = "UTF-8";
    private long chunkSize = 64L * 1024 * 1024; // 64MB mapped windows

    /**
     * Checks every option and fills in the default output path when none is set.
     * Output existence is left to the writer.
     */
    public void validate() throws InvalidConfigurationException {
        if (inputFile == null || inputFile.getPath().isEmpty()) {
            throw new InvalidConfigurationException("input", "input file path is required");
        }
        if (!inputFile.exists()) {
            throw new InvalidConfigurationException("input", "input file does not exist: " + inputFile);
        }
        if (!inputFile.isFile()) {
            throw new InvalidConfigurationException("input", "input path is not a regular file: " + inputFile);
        }
        if (!inputFile.canRead()) {
            throw new InvalidConfigurationException("input", "cannot read input file: " + inputFile);
        }
        if (!H3Resolution.isValidLevel(resolution)) {
            throw new InvalidConfigurationException("resolution", "H3 resolution " + resolution
                    + " is out of valid range [" + H3Resolution.MIN_LEVEL + ", " + H3Resolution.MAX_LEVEL + "]");
        }
        if (delimiter == '\n' || delimiter == '\r' || delimiter == quoteChar) {
            throw new InvalidConfigurationException("delimiter", "delimiter cannot be a line break or the quote character");
        }
        String p = parser == null ? "" : parser.toLowerCase(Locale.ROOT);
        if (!p.equals(CsvParserStrategy.UNIVOCITY) && !p.equals(CsvParserStrategy.COMMONS)) {
            throw new InvalidConfigurationException("parser", "unknown parser '" + parser + "'");
        }
        if (chunkSize <= 0 || chunkSize > Integer.MAX_VALUE) {
            throw new InvalidConfigurationException("chunkSize", "must be between 1 and " + Integer.MAX_VALUE);
        }

        if (outputFile == null || outputFile.getPath().isEmpty()) {
            outputFile = defaultOutputFile(inputFile);
        }
        File parent = outputFile.getAbsoluteFile().getParentFile();
        if (parent == null || !parent.isDirectory()) {
            throw new InvalidConfigurationException("output", "output directory does not exist: " + parent);
        }
        if (outputFile.getAbsoluteFile().equals(inputFile.getAbsoluteFile())) {
            throw new InvalidConfigurationException("output", "output file must differ from the input file");
        }
    }

    /** {@code data/points.csv} becomes {@code data/points_with_h3.csv}. */
    public static File defaultOutputFile(File input) {
        String name = input.getName();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        return new File(input.getAbsoluteFile().getParentFile(), base + OUTPUT_SUFFIX + ext);
    }

    public H3Resolution getResolutionLevel() {
        return H3Resolution.ofLevel(resolution);
    }
}
