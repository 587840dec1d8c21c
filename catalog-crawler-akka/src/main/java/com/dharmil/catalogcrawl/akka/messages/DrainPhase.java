package com.dharmil.catalogcrawl.akka.messages;

import java.time.Duration;

/**
 * Stops dispatch and finishes the phase once in-flight tasks report or {@code timeout} elapses,
 * whichever comes first.
 */
public record DrainPhase(Duration timeout) implements CrawlMessage {
}
