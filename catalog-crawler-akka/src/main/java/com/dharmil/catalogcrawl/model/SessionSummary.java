package com.dharmil.catalogcrawl.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Registry-level view of a session, as returned by {@code ListSessions}.
 */
public record SessionSummary(String sessionId, SessionStatus status, Instant startedAt, Instant completedAt)
        implements Serializable {
}
