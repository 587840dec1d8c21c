package com.dharmil.catalogcrawl.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a crawl session: {@code Running -> {Paused <-> Running} -> {Completed | Failed} -> ShuttingDown}.
 */
public enum SessionStatus {
    RUNNING("Running"),
    PAUSED("Paused"),
    COMPLETED("Completed"),
    FAILED("Failed"),
    SHUTTING_DOWN("ShuttingDown");

    private final String label;

    SessionStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SHUTTING_DOWN;
    }

    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }
}
