package com.example.h3csv.csv;

import java.io.IOException;

/**
 * A single row could not be parsed. The source has already moved past it, so reading
 * may continue with the next row.
 */
public class RowSyntaxException extends IOException {

    public RowSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
