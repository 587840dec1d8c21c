package com.dharmil.catalogcrawl.akka.messages;

public record SessionStartedReply(String sessionId) implements CrawlMessage {
}
