package com.dharmil.catalogcrawl.akka.messages;

import com.dharmil.catalogcrawl.model.SessionSummary;

/**
 * Sent by a session to the registry on every lifecycle transition.
 */
public record SessionStatusChanged(SessionSummary summary) implements CrawlMessage {
}
