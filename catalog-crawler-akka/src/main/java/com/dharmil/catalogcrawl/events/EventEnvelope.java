package com.dharmil.catalogcrawl.events;

import java.time.Instant;

/**
 * An event stamped by the broadcaster.
 *
 * @param seq       strictly increasing per broadcaster, starting at 1
 * @param backendTs time the event was published
 */
public record EventEnvelope(long seq, Instant backendTs, CrawlEvent event) {
}
