package com.example.h3csv;

/**
 * Root of the checked exceptions raised while indexing a delimited file.
 */
public class GeoIndexException extends Exception {

    public GeoIndexException(String message) {
        super(message);
    }

    public GeoIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
