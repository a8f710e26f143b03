package com.example.h3csv.csv;

import java.util.List;

/**
 * Maps latitude/longitude column specifiers onto field positions.
 *
 * <p>With a header, a specifier is matched case-insensitively against the header
 * names; when it is empty or matches nothing the field's {@link CoordinateField#aliases()
 * aliases} are tried in order, the leftmost column winning. Without a header a
 * specifier must be a non-negative integer, optionally written with a leading {@code +}.</p>
 */
public final class ColumnResolver {

    private ColumnResolver() {}

    /**
     * @param headers header names, or {@code null} when the input has no header row
     */
    public static ColumnMapping resolve(List<String> headers, String latitudeSpec, String longitudeSpec)
            throws ColumnResolutionException {
        int lat;
        int lng;
        if (headers != null) {
            lat = findByName(headers, latitudeSpec, CoordinateField.LATITUDE);
            lng = findByName(headers, longitudeSpec, CoordinateField.LONGITUDE);
        } else {
            lat = parsePosition(latitudeSpec, CoordinateField.LATITUDE);
            lng = parsePosition(longitudeSpec, CoordinateField.LONGITUDE);
        }
        if (lat == lng) {
            throw ColumnResolutionException.sameColumn(lat);
        }
        return new ColumnMapping(lat, lng);
    }

    static int findByName(List<String> headers, String specifier, CoordinateField field)
            throws ColumnResolutionException {
        String wanted = specifier == null ? "" : specifier.trim();
        if (!wanted.isEmpty()) {
            int index = indexOfIgnoreCase(headers, wanted);
            if (index >= 0) {
                return index;
            }
        }
        for (String alias : field.aliases()) {
            int index = indexOfIgnoreCase(headers, alias);
            if (index >= 0) {
                return index;
            }
        }
        throw ColumnResolutionException.notFound(field, specifier);
    }

    static int parsePosition(String specifier, CoordinateField field) throws ColumnResolutionException {
        if (specifier == null) {
            throw ColumnResolutionException.notFound(field, null);
        }
        String text = specifier.trim();
        String digits = text.startsWith("+") ? text.substring(1) : text;
        // an optional '+' then digits only; a '-' can never name a column
        if (digits.isEmpty() || !digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw ColumnResolutionException.notFound(field, specifier);
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw ColumnResolutionException.notFound(field, specifier);
        }
    }

    private static int indexOfIgnoreCase(List<String> headers, String name) {
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            if (header != null && header.trim().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }
}
