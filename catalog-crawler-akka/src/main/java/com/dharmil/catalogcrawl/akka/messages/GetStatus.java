package com.dharmil.catalogcrawl.akka.messages;

/**
 * Answered with a {@code SessionStatusView}; never changes session state.
 */
public record GetStatus(String sessionId) implements SessionCommand {
}
