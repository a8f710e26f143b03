package com.example.h3csv.geo;

import lombok.Getter;

/**
 * H3 resolution levels with the approximate hexagon edge length of each level.
 */
@Getter
public enum H3Resolution {
    COUNTRY(0, "Country", "~1107.71 km", "Continental/country-wide analysis"),
    STATE(1, "State", "~418.68 km", "State/province-wide analysis"),
    METRO(2, "Metro", "~158.24 km", "Metropolitan area analysis"),
    CITY(3, "City", "~59.81 km", "City-wide analysis"),
    DISTRICT(4, "District", "~22.61 km", "District/county analysis"),
    NEIGHBORHOOD(5, "Neighborhood", "~8.54 km", "Neighborhood analysis"),
    BLOCK(6, "Block", "~3.23 km", "City block analysis"),
    BUILDING(7, "Building", "~1.22 km", "Building cluster analysis"),
    STREET(8, "Street", "~461.35 m", "Street-level analysis"),
    INTERSECTION(9, "Intersection", "~174.38 m", "Street intersection analysis"),
    PROPERTY(10, "Property", "~65.91 m", "Property/lot analysis"),
    ROOM(11, "Room", "~24.91 m", "Room-level analysis"),
    DESK(12, "Desk", "~9.42 m", "Desk/workspace analysis"),
    CHAIR(13, "Chair", "~3.56 m", "Chair/seat analysis"),
    BOOK(14, "Book", "~1.35 m", "Book/object analysis"),
    PAGE(15, "Page", "~0.51 m", "Page/fine-detail analysis");

    public static final int MIN_LEVEL = 0;
    public static final int MAX_LEVEL = 15;
    public static final H3Resolution DEFAULT = STREET;

    private final int level;
    private final String label;
    private final String edgeLength;
    private final String useCase;

    H3Resolution(int level, String label, String edgeLength, String useCase) {
        this.level = level;
        this.label = label;
        this.edgeLength = edgeLength;
        this.useCase = useCase;
    }

    public static boolean isValidLevel(int level) {
        return level >= MIN_LEVEL && level <= MAX_LEVEL;
    }

    public static H3Resolution ofLevel(int level) {
        if (!isValidLevel(level)) {
            throw new IllegalArgumentException("H3 resolution " + level + " is out of valid range ["
                    + MIN_LEVEL + ", " + MAX_LEVEL + "]");
        }
        return values()[level];
    }

    /** e.g. "Street level (~461.35 m)". */
    public String describe() {
        return label + " level (" + edgeLength + ")";
    }
}
