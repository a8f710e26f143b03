package com.example.h3csv.csv;

import com.example.h3csv.JobSetupException;
import lombok.Getter;

/**
 * The coordinate columns could not be located. Raised at setup, never mid-stream.
 */
@Getter
public class ColumnResolutionException extends JobSetupException {

    public enum Reason {
        COLUMN_NOT_FOUND,
        SAME_COLUMN
    }

    private final Reason reason;
    private final CoordinateField field;

    private ColumnResolutionException(Reason reason, CoordinateField field, String message) {
        super(message);
        this.reason = reason;
        this.field = field;
    }

    public static ColumnResolutionException notFound(CoordinateField field, String specifier) {
        return new ColumnResolutionException(Reason.COLUMN_NOT_FOUND, field,
                field.displayName() + " column not found: '" + specifier + "'");
    }

    public static ColumnResolutionException sameColumn(int index) {
        return new ColumnResolutionException(Reason.SAME_COLUMN, null,
                "latitude and longitude resolve to the same column (index " + index + ")");
    }
}
