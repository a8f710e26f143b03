package com.example.h3csv;

/**
 * Raised before the first record is read. A job failing with this exception
 * has produced no output rows.
 */
public class JobSetupException extends GeoIndexException {

    public JobSetupException(String message) {
        super(message);
    }

    public JobSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
