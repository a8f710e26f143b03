package com.example.h3csv.geo;

import com.example.h3csv.GeoIndexException;
import lombok.Getter;

/**
 * A coordinate pair lies outside the geographic domain.
 */
@Getter
public class InvalidCoordinateException extends GeoIndexException {

    private final double latitude;
    private final double longitude;

    public InvalidCoordinateException(double latitude, double longitude, String message) {
        super(message);
        this.latitude = latitude;
        this.longitude = longitude;
    }
}
