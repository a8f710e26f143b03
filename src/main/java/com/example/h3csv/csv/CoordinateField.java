package com.example.h3csv.csv;

import java.util.List;

/**
 * The two coordinate columns of a row, with the header aliases tried when
 * the configured column name does not match.
 */
public enum CoordinateField {
    LATITUDE("latitude", List.of("lat", "latitude", "y")),
    LONGITUDE("longitude", List.of("lng", "lon", "longitude", "x"));

    private final String displayName;
    private final List<String> aliases;

    CoordinateField(String displayName, List<String> aliases) {
        this.displayName = displayName;
        this.aliases = aliases;
    }

    public String displayName() {
        return displayName;
    }

    /** Conventional header names, in the order they are tried. */
    public List<String> aliases() {
        return aliases;
    }
}
