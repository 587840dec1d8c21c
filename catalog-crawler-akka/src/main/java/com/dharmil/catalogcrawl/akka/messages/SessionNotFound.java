package com.dharmil.catalogcrawl.akka.messages;

public record SessionNotFound(String sessionId) implements CrawlMessage {
}
