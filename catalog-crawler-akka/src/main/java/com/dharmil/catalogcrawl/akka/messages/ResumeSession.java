package com.dharmil.catalogcrawl.akka.messages;

public record ResumeSession(String sessionId) implements SessionCommand {
}
