package com.example.h3csv.geo;

/**
 * Computes the spatial index token for a coordinate pair.
 * Implementations must be deterministic: the same pair and resolution always yield the same token.
 */
public interface IndexGenerator {

    String generate(double latitude, double longitude, int resolution) throws IndexGenerationException;

    /**
     * Called once at job setup, before any record is processed.
     */
    default void validateResolution(int resolution) {
        if (!H3Resolution.isValidLevel(resolution)) {
            throw new IllegalArgumentException("H3 resolution " + resolution + " is out of valid range ["
                    + H3Resolution.MIN_LEVEL + ", " + H3Resolution.MAX_LEVEL + "]");
        }
    }
}
