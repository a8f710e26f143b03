package com.example.h3csv;

import com.example.h3csv.csv.CsvParserStrategy;
import com.example.h3csv.util.CharsetResolver;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * Writes a synthetic coordinate file for performance testing. Output is fully
 * determined by the seed.
 *
 * Usage example:
 *   h3csv sample /tmp/points.csv 1000000 --invalid-ratio 0.05
 */
@Slf4j
@Command(name = "sample", description = "Generate a synthetic CSV of named coordinates for benchmarking")
class SampleDataCommand implements Callable<Integer> {

    static final String[] NAMES = {
            "alpha", "beta", "gamma", "δelta", "数据", "测试", "Zürich", "São Paulo", "含,逗号", "\"quoted\""
    };

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "OUTPUT", description = "File to write")
    File outputFile;

    @Parameters(index = "1", paramLabel = "ROWS", description = "Number of data rows")
    long rows;

    @Option(names = "--invalid-ratio", defaultValue = "0.0",
            description = "Share of rows with empty, non-numeric or out-of-range coordinates (default: ${DEFAULT-VALUE})")
    double invalidRatio;

    @Option(names = "--seed", defaultValue = "12345", description = "Random seed (default: ${DEFAULT-VALUE})")
    long seed;

    @Option(names = {"-e", "--encoding"}, defaultValue = "UTF-8", description = "Output encoding (default: ${DEFAULT-VALUE})")
    String encoding;

    @Override
    public Integer call() throws IOException {
        if (rows < 0) {
            throw new ParameterException(spec.commandLine(), "ROWS must be >= 0, got " + rows);
        }
        if (invalidRatio < 0 || invalidRatio > 1) {
            throw new ParameterException(spec.commandLine(), "--invalid-ratio must be within [0, 1], got " + invalidRatio);
        }
        Charset cs = CharsetResolver.resolve(encoding);
        try (Writer out = new BufferedWriter(new OutputStreamWriter(Files.newOutputStream(outputFile.toPath()), cs))) {
            write(out, rows, invalidRatio, new Random(seed));
        }
        log.info("Wrote sample file {} rows={}, encoding={}", outputFile.getAbsolutePath(), rows, cs.name());
        return 0;
    }

    static void write(Writer out, long rows, double invalidRatio, Random rnd) throws IOException {
        CsvParserStrategy.RowPrinter printer = CsvParserStrategy.create(CsvParserStrategy.UNIVOCITY, ',', '"')
                .printer(out);
        printer.printRow(new String[] {"id", "name", "latitude", "longitude"});
        for (long i = 0; i < rows; i++) {
            String name = NAMES[rnd.nextInt(NAMES.length)];
            String lat;
            String lng;
            if (rnd.nextDouble() < invalidRatio) {
                switch (rnd.nextInt(3)) {
                    case 0:
                        lat = "";
                        lng = coordinate(rnd, 180);
                        break;
                    case 1:
                        lat = "n/a";
                        lng = coordinate(rnd, 180);
                        break;
                    default:
                        lat = "95.0";
                        lng = coordinate(rnd, 180);
                }
            } else {
                lat = coordinate(rnd, 90);
                lng = coordinate(rnd, 180);
            }
            printer.printRow(new String[] {Long.toString(i), name, lat, lng});
            if ((i & 0xFFFF) == 0 && i > 0) {
                log.info("Generated {} rows", i);
            }
        }
        printer.flush();
    }

    private static String coordinate(Random rnd, double bound) {
        return String.format(Locale.ROOT, "%.6f", (rnd.nextDouble() * 2 - 1) * bound);
    }
}
