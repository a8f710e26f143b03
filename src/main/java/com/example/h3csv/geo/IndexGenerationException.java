package com.example.h3csv.geo;

import com.example.h3csv.GeoIndexException;

public class IndexGenerationException extends GeoIndexException {

    public IndexGenerationException(String message) {
        super(message);
    }

    public IndexGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
