package com.example.h3csv.geo;

/**
 * Accepts latitude in [-90, 90] and longitude in [-180, 180], bounds inclusive.
 * NaN never passes.
 */
public class GeographicCoordinateValidator implements CoordinateValidator {

    public static final double MIN_LATITUDE = -90.0;
    public static final double MAX_LATITUDE = 90.0;
    public static final double MIN_LONGITUDE = -180.0;
    public static final double MAX_LONGITUDE = 180.0;

    @Override
    public void validate(double latitude, double longitude) throws InvalidCoordinateException {
        // written as !(in range) so that NaN is rejected
        if (!(latitude >= MIN_LATITUDE && latitude <= MAX_LATITUDE)) {
            throw new InvalidCoordinateException(latitude, longitude,
                    "latitude " + latitude + " is outside [" + MIN_LATITUDE + ", " + MAX_LATITUDE + "]");
        }
        if (!(longitude >= MIN_LONGITUDE && longitude <= MAX_LONGITUDE)) {
            throw new InvalidCoordinateException(latitude, longitude,
                    "longitude " + longitude + " is outside [" + MIN_LONGITUDE + ", " + MAX_LONGITUDE + "]");
        }
    }
}
