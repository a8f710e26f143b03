package com.example.h3csv.processing;

import com.example.h3csv.GeoIndexException;
import lombok.Getter;

/**
 * The sink could not take a record. Fatal for the job; rows already written stay written.
 */
@Getter
public class RecordSinkException extends GeoIndexException {

    private final long lineNumber;

    public RecordSinkException(long lineNumber, Throwable cause) {
        super("record sink failed at line " + lineNumber + ": " + cause.getMessage(), cause);
        this.lineNumber = lineNumber;
    }
}
