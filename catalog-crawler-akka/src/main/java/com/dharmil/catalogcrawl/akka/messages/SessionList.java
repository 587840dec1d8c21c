package com.dharmil.catalogcrawl.akka.messages;

import com.dharmil.catalogcrawl.model.SessionSummary;

import java.util.List;

public record SessionList(List<SessionSummary> sessions) implements CrawlMessage {

    public SessionList {
        sessions = List.copyOf(sessions);
    }
}
