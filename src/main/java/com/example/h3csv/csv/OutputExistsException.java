package com.example.h3csv.csv;

import com.example.h3csv.JobSetupException;
import lombok.Getter;

import java.nio.file.Path;

@Getter
public class OutputExistsException extends JobSetupException {

    private final Path path;

    public OutputExistsException(Path path) {
        super("output file already exists: " + path + " (use --overwrite to replace it)");
        this.path = path;
    }
}
