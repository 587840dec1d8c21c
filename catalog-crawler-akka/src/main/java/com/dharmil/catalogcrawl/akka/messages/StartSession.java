package com.dharmil.catalogcrawl.akka.messages;

import com.dharmil.catalogcrawl.model.RestorePlan;
import com.dharmil.catalogcrawl.model.SessionConfig;

/**
 * Asks the registry to create and start a session. Answered with {@link SessionStartedReply}
 * or {@link CommandRejected}.
 *
 * @param restorePlan unfinished work from a resume token, or {@code null} for a fresh crawl
 */
public record StartSession(SessionConfig config, RestorePlan restorePlan) implements CrawlMessage {
}
