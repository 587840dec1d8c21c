package com.dharmil.catalogcrawl.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-task state machine:
 * {@code QUEUED -> DISPATCHED -> (SUCCEEDED | FAILED | TIMED_OUT) -> [RETRYING -> DISPATCHED]* -> (COMPLETED | PERMANENTLY_FAILED)}.
 */
public enum TaskState {
    QUEUED,
    DISPATCHED,
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    RETRYING,
    COMPLETED,
    PERMANENTLY_FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PERMANENTLY_FAILED;
    }

    public boolean canTransitionTo(TaskState next) {
        return allowedNext().contains(next);
    }

    private Set<TaskState> allowedNext() {
        return switch (this) {
            case QUEUED, RETRYING -> EnumSet.of(DISPATCHED);
            case DISPATCHED -> EnumSet.of(SUCCEEDED, FAILED, TIMED_OUT);
            case SUCCEEDED -> EnumSet.of(COMPLETED);
            case FAILED, TIMED_OUT -> EnumSet.of(RETRYING, PERMANENTLY_FAILED);
            case COMPLETED, PERMANENTLY_FAILED -> EnumSet.noneOf(TaskState.class);
        };
    }
}
