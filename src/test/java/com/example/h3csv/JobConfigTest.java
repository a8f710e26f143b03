package com.example.h3csv;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobConfigTest {

    @TempDir
    Path dir;

    private JobConfig configFor(Path input) {
        JobConfig config = new JobConfig();
        config.setInputFile(input.toFile());
        return config;
    }

    @Test
    void defaultsMatchTheCommandLine() {
        JobConfig config = new JobConfig();

        assertThat(config.getLatColumn()).isEqualTo("latitude");
        assertThat(config.getLngColumn()).isEqualTo("longitude");
        assertThat(config.getResolution()).isEqualTo(8);
        assertThat(config.isHasHeaders()).isTrue();
        assertThat(config.getDelimiter()).isEqualTo(',');
        assertThat(config.isOverwrite()).isFalse();
        assertThat(config.getParser()).isEqualTo("univocity");
    }

    @Test
    void defaultOutputSitsNextToInput() {
        File input = new File(dir.toFile(), "points.csv");

        assertThat(JobConfig.defaultOutputFile(input)).isEqualTo(new File(dir.toFile(), "points_with_h3.csv"));
        assertThat(JobConfig.defaultOutputFile(new File(dir.toFile(), "archive.tar.gz")).getName())
                .isEqualTo("archive.tar_with_h3.gz");
        assertThat(JobConfig.defaultOutputFile(new File(dir.toFile(), "points")).getName())
                .isEqualTo("points_with_h3");
        assertThat(JobConfig.defaultOutputFile(new File(dir.toFile(), ".hidden")).getName())
                .isEqualTo(".hidden_with_h3");
    }

    @Test
    void validateFillsInOutput() throws Exception {
        JobConfig config = configFor(Files.createFile(dir.resolve("in.csv")));

        config.validate();

        assertThat(config.getOutputFile()).isEqualTo(dir.resolve("in_with_h3.csv").toFile());
    }

    @Test
    void validateKeepsExplicitOutput() throws Exception {
        JobConfig config = configFor(Files.createFile(dir.resolve("in.csv")));
        File out = dir.resolve("custom.csv").toFile();
        config.setOutputFile(out);

        config.validate();

        assertThat(config.getOutputFile()).isEqualTo(out);
    }

    @Test
    void rejectsMissingOrDirectoryInput() {
        assertThatThrownBy(() -> new JobConfig().validate())
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("required");
        assertThatThrownBy(() -> configFor(dir.resolve("missing.csv")).validate())
                .hasMessageContaining("does not exist");
        assertThatThrownBy(() -> configFor(dir).validate())
                .hasMessageContaining("not a regular file");
    }

    @Test
    void rejectsBadOptions() throws IOException {
        Path input = Files.createFile(dir.resolve("in.csv"));

        JobConfig resolution = configFor(input);
        resolution.setResolution(-1);
        assertOption(resolution, "resolution");

        JobConfig delimiter = configFor(input);
        delimiter.setDelimiter('"');
        assertOption(delimiter, "delimiter");

        JobConfig newline = configFor(input);
        newline.setDelimiter('\n');
        assertOption(newline, "delimiter");

        JobConfig parser = configFor(input);
        parser.setParser("opencsv");
        assertOption(parser, "parser");

        JobConfig chunk = configFor(input);
        chunk.setChunkSize(0);
        assertOption(chunk, "chunkSize");
    }

    @Test
    void parserNameIsCaseInsensitive() throws Exception {
        JobConfig config = configFor(Files.createFile(dir.resolve("in.csv")));
        config.setParser("Commons");

        config.validate();
    }

    @Test
    void rejectsOutputEqualToInputOrInMissingDirectory() throws IOException {
        Path input = Files.createFile(dir.resolve("in.csv"));

        JobConfig same = configFor(input);
        same.setOutputFile(input.toFile());
        assertOption(same, "output");

        JobConfig missingDir = configFor(input);
        missingDir.setOutputFile(dir.resolve("no/such/dir/out.csv").toFile());
        assertOption(missingDir, "output");
    }

    @Test
    void exposesResolutionLevel() {
        JobConfig config = new JobConfig();
        config.setResolution(0);

        assertThat(config.getResolutionLevel().getLevel()).isZero();
    }

    private static void assertOption(JobConfig config, String option) {
        assertThatThrownBy(config::validate)
                .isInstanceOfSatisfying(InvalidConfigurationException.class,
                        e -> assertThat(e.getOption()).isEqualTo(option));
    }
}
