package com.dharmil.catalogcrawl.akka.messages;

/**
 * A command addressed to one session; the registry routes it by {@link #sessionId()}.
 */
public interface SessionCommand extends CrawlMessage {
    String sessionId();
}
