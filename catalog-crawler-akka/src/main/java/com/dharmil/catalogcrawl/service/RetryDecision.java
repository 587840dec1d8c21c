package com.dharmil.catalogcrawl.service;

import com.dharmil.catalogcrawl.model.CrawlErrorKind;

import java.time.Duration;

/**
 * What to do with a task after a failed attempt.
 *
 * @param attempt retry number granted (1-based) when {@code retry}, otherwise retries already used
 * @param delay   time before the task becomes eligible again; {@link Duration#ZERO} when giving up
 */
public record RetryDecision(boolean retry, int attempt, Duration delay, CrawlErrorKind kind, String reason) {

    static RetryDecision retryAfter(int attempt, Duration delay, CrawlErrorKind kind) {
        return new RetryDecision(true, attempt, delay, kind, null);
    }

    static RetryDecision giveUp(int attempts, CrawlErrorKind kind, String reason) {
        return new RetryDecision(false, attempts, Duration.ZERO, kind, reason);
    }
}
