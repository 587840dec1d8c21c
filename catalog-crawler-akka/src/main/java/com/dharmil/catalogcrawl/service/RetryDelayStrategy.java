package com.dharmil.catalogcrawl.service;

import com.dharmil.catalogcrawl.model.CrawlErrorKind;

import java.time.Duration;

/**
 * Computes how long a failed task waits before it becomes eligible for another attempt.
 */
public interface RetryDelayStrategy {

    /**
     * @param attempt 1-based retry number
     */
    Duration delay(int attempt);

    /**
     * Delay for a retry caused by the given failure; rate-limited failures wait twice as long.
     */
    default Duration delayFor(int attempt, CrawlErrorKind kind) {
        Duration base = delay(attempt);
        return kind == CrawlErrorKind.RATE_LIMITED ? base.multipliedBy(2) : base;
    }
}
