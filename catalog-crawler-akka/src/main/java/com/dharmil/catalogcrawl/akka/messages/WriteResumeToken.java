package com.dharmil.catalogcrawl.akka.messages;

public record WriteResumeToken(String sessionId, String planHash, String tokenJson, boolean checkpoint)
        implements CrawlMessage {
}
