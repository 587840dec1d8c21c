package com.dharmil.catalogcrawl.akka.messages;

/** Answered with {@link SessionList}. */
public record ListSessions() implements CrawlMessage {
}
