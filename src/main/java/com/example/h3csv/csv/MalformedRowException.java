package com.example.h3csv.csv;

import com.example.h3csv.GeoIndexException;
import lombok.Getter;

/**
 * A row cannot be used: it is too short to reach both coordinate columns, or the parser
 * rejected it. The row is skipped, the stream goes on.
 */
@Getter
public class MalformedRowException extends GeoIndexException {

    private final long lineNumber;
    // -1 when the row could not be split into fields at all
    private final int expectedFields;
    private final int actualFields;

    public MalformedRowException(long lineNumber, int expectedFields, int actualFields) {
        super("row has insufficient columns: expected at least " + expectedFields + ", got " + actualFields);
        this.lineNumber = lineNumber;
        this.expectedFields = expectedFields;
        this.actualFields = actualFields;
    }

    public MalformedRowException(long lineNumber, RowSyntaxException cause) {
        super(cause.getMessage(), cause);
        this.lineNumber = lineNumber;
        this.expectedFields = -1;
        this.actualFields = -1;
    }
}
