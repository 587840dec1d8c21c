package com.dharmil.catalogcrawl.model;

/**
 * Final report of a phase coordinator.
 */
public record PhaseResult(PhaseKind phase, Outcome outcome, PhaseSnapshot snapshot, String reason) {

    public enum Outcome {
        /** Every task completed or permanently failed below the failure threshold. */
        COMPLETED,
        THRESHOLD_EXCEEDED,
        /** Drained on shutdown; undrained tasks were recorded as permanently failed. */
        ABORTED,
        INTERNAL_ERROR
    }

    public boolean isSuccess() {
        return outcome == Outcome.COMPLETED;
    }
}
