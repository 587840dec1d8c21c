package com.dharmil.catalogcrawl.model;

/**
 * Retry bookkeeping for one task.
 *
 * @param attempts number of retries granted so far
 */
public record RetryRecord(String taskKey, int attempts, CrawlErrorKind lastErrorKind) {

    public RetryRecord next(CrawlErrorKind kind) {
        return new RetryRecord(taskKey, attempts + 1, kind);
    }
}
