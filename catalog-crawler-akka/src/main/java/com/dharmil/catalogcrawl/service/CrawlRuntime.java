package com.dharmil.catalogcrawl.service;

import com.dharmil.catalogcrawl.events.CrawlEventBroadcaster;
import com.dharmil.catalogcrawl.resume.ResumeTokenManager;
import com.dharmil.catalogcrawl.resume.ResumeTokenStore;

import java.time.Clock;

/**
 * Shared, thread-safe collaborators handed to every session and phase actor.
 *
 * @param dispatcherId Akka dispatcher that runs task futures
 */
public record CrawlRuntime(TaskExecutor taskExecutor,
                           String dispatcherId,
                           CrawlEventBroadcaster events,
                           ResumeTokenManager tokens,
                           ResumeTokenStore tokenStore,
                           StatusAggregator statusAggregator,
                           Clock clock) {
}
