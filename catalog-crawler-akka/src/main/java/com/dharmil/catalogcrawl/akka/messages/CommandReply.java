package com.dharmil.catalogcrawl.akka.messages;

import com.dharmil.catalogcrawl.model.SessionStatus;

/**
 * Answer to a session control command.
 */
public interface CommandReply extends CrawlMessage {

    String sessionId();

    SessionStatus status();

    boolean accepted();
}
