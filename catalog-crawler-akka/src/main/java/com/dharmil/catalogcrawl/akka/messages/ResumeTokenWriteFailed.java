package com.dharmil.catalogcrawl.akka.messages;

public record ResumeTokenWriteFailed(String sessionId, boolean checkpoint, String reason) implements CrawlMessage {
}
