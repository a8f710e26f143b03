package com.example.h3csv.processing;

/**
 * What happened to one input row. {@link #MALFORMED} rows produce no output;
 * every other outcome produces exactly one output row.
 */
public enum RecordOutcome {
    /** Too few fields to reach the coordinate columns. Skipped. */
    MALFORMED(false),
    /** Coordinate text empty or not a number. */
    UNPARSEABLE(true),
    /** Parsed, but outside the geographic domain. */
    OUT_OF_RANGE(true),
    /** The index generator rejected the coordinates. */
    GENERATION_FAILED(true),
    INDEXED(true);

    private final boolean forwarded;

    RecordOutcome(boolean forwarded) {
        this.forwarded = forwarded;
    }

    public boolean isForwarded() {
        return forwarded;
    }

    public boolean isValid() {
        return this == INDEXED;
    }
}
