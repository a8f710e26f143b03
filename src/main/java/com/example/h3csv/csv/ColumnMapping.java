package com.example.h3csv.csv;

import lombok.Value;

/**
 * Zero-based positions of the coordinate columns. Always non-negative and distinct.
 */
@Value
public class ColumnMapping {
    int latitudeIndex;
    int longitudeIndex;

    /** Smallest field count a row needs to reach both columns. */
    public int requiredFieldCount() {
        return Math.max(latitudeIndex, longitudeIndex) + 1;
    }
}
