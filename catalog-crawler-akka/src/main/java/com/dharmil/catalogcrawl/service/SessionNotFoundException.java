package com.dharmil.catalogcrawl.service;

/**
 * No session with the given id is known to the registry, either because it never existed or
 * because it was removed after its grace period.
 */
public class SessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Unknown crawl session: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
