package com.example.h3csv.csv;

import lombok.Getter;
import lombok.ToString;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One data row in flight: the raw fields as read, plus the parsed coordinates and the
 * derived index. Created by {@link RecordReader}, completed by the processor, written once.
 */
@Getter
@ToString
public class GeoRecord {

    private final List<String> originalFields;
    private final long lineNumber;

    private double latitude;
    private double longitude;
    private String derivedIndex = "";
    private boolean valid;

    public GeoRecord(String[] fields, long lineNumber) {
        this.originalFields = Collections.unmodifiableList(Arrays.asList(fields.clone()));
        this.lineNumber = lineNumber;
    }

    void setCoordinates(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.valid = true;
    }

    public void markIndexed(String index) {
        this.derivedIndex = index;
        this.valid = true;
    }

    public void markInvalid() {
        this.derivedIndex = "";
        this.valid = false;
    }
}
