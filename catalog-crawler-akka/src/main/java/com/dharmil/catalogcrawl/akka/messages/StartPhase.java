package com.dharmil.catalogcrawl.akka.messages;

/**
 * Starts a phase coordinator.
 *
 * @param paused true to admit the first batch without dispatching anything
 */
public record StartPhase(boolean paused) implements CrawlMessage {
}
