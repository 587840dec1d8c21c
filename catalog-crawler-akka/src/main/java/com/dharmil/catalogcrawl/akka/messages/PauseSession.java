package com.dharmil.catalogcrawl.akka.messages;

public record PauseSession(String sessionId) implements SessionCommand {
}
