package com.example.h3csv.processing;

/**
 * Receives a note for every record outcome. Purely observational: nothing here may
 * influence control flow or counts. Each job gets its own instance.
 */
public interface ProcessingDiagnostics {

    ProcessingDiagnostics NONE = new ProcessingDiagnostics() {
        @Override
        public void onOutcome(RecordOutcome outcome, long lineNumber, String detail) {
        }
    };

    /**
     * @param detail reason for a non-indexed outcome, the index for {@link RecordOutcome#INDEXED}
     */
    void onOutcome(RecordOutcome outcome, long lineNumber, String detail);

    default void onProgress(long forwarded) {
    }

    default void onComplete(ProcessingTally tally) {
    }
}
