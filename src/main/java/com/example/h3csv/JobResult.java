package com.example.h3csv;

import com.example.h3csv.processing.ProcessingTally;
import lombok.Value;

import java.io.File;
import java.time.Duration;

@Value
public class JobResult {
    long totalRecords;
    long validRecords;
    long invalidRecords;
    long malformedRows;
    Duration duration;
    File outputFile;

    static JobResult of(ProcessingTally tally, Duration duration, File outputFile) {
        return new JobResult(tally.getTotalRecords(), tally.getValidRecords(), tally.getInvalidRecords(),
                tally.getMalformedRows(), duration, outputFile);
    }

    public long recordsPerSecond() {
        long millis = Math.max(1, duration.toMillis());
        return totalRecords * 1000 / millis;
    }
}
