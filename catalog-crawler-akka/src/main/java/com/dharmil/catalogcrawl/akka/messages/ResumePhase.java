package com.dharmil.catalogcrawl.akka.messages;

public record ResumePhase() implements CrawlMessage {
}
