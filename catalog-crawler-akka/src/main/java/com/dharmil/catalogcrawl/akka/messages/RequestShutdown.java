package com.dharmil.catalogcrawl.akka.messages;

/**
 * Stops dispatch, drains in-flight work up to the session's shutdown timeout and emits a resume token.
 */
public record RequestShutdown(String sessionId) implements SessionCommand {
}
