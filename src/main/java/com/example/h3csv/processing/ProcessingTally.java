package com.example.h3csv.processing;

import lombok.Value;

/**
 * Counters of a finished stream.
 *
 * <p>{@code totalRecords} counts rows forwarded to the sink only: malformed rows are
 * excluded from it and show up in {@code malformedRows} and {@code errorCount} instead.
 * {@code errorCount} counts malformed rows plus every invalid record.</p>
 */
@Value
public class ProcessingTally {
    long totalRecords;
    long validRecords;
    long malformedRows;
    long errorCount;

    public long getInvalidRecords() {
        return totalRecords - validRecords;
    }
}
