package com.example.h3csv.processing;

import lombok.extern.slf4j.Slf4j;

/**
 * SLF4J backed diagnostics. Per-record messages are emitted only in verbose mode;
 * progress and the final summary are always logged.
 */
@Slf4j
public class LoggingDiagnostics implements ProcessingDiagnostics {

    private final boolean verbose;

    public LoggingDiagnostics(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public void onOutcome(RecordOutcome outcome, long lineNumber, String detail) {
        if (!verbose) {
            return;
        }
        switch (outcome) {
            case MALFORMED:
                log.warn("Skipping malformed row at line {}: {}", lineNumber, detail);
                break;
            case UNPARSEABLE:
                log.warn("Invalid record at line {}: empty or malformed coordinates ({})", lineNumber, detail);
                break;
            case OUT_OF_RANGE:
                log.warn("Invalid coordinates at line {}: {}", lineNumber, detail);
                break;
            case GENERATION_FAILED:
                log.warn("H3 generation failed at line {}: {}", lineNumber, detail);
                break;
            default:
                log.info("Line {}: indexed as {}", lineNumber, detail);
        }
    }

    @Override
    public void onProgress(long forwarded) {
        log.info("Processed {} records", forwarded);
    }

    @Override
    public void onComplete(ProcessingTally tally) {
        log.info("Processing complete: {} total records, {} valid, {} invalid, {} malformed rows skipped",
                tally.getTotalRecords(), tally.getValidRecords(), tally.getInvalidRecords(), tally.getMalformedRows());
    }
}
