package com.dharmil.catalogcrawl.akka.messages;

public record PausePhase() implements CrawlMessage {
}
