package com.example.h3csv.geo;

/**
 * Checks a latitude/longitude pair against the valid geographic domain.
 */
public interface CoordinateValidator {

    void validate(double latitude, double longitude) throws InvalidCoordinateException;
}
