package com.dharmil.catalogcrawl.service;

import com.dharmil.catalogcrawl.model.CrawlErrorKind;
import com.dharmil.catalogcrawl.model.PageTask;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryManagerTest {

    private final RetryManager retries = new RetryManager(3, 1, new FixedRetryDelay(Duration.ofMillis(100)));

    @Test
    void classifiesEveryErrorKind() {
        assertEquals(RetryManager.Classification.TRANSIENT, RetryManager.classify(CrawlErrorKind.NETWORK_TIMEOUT));
        assertEquals(RetryManager.Classification.TRANSIENT, RetryManager.classify(CrawlErrorKind.SERVER_ERROR));
        assertEquals(RetryManager.Classification.TRANSIENT, RetryManager.classify(CrawlErrorKind.PARSE_ERROR));
        assertEquals(RetryManager.Classification.RATE_LIMITED, RetryManager.classify(CrawlErrorKind.RATE_LIMITED));
        assertEquals(RetryManager.Classification.PERMANENT, RetryManager.classify(CrawlErrorKind.PERMANENT));
        assertEquals(RetryManager.Classification.PERMANENT, RetryManager.classify(CrawlErrorKind.INTERNAL_ERROR));
    }

    @Test
    void transientFailureIsRetriedUntilBudgetIsExhausted() {
        PageTask page = new PageTask(7);
        for (int attempt = 1; attempt <= 3; attempt++) {
            RetryDecision decision = retries.onFailure(page, CrawlErrorKind.SERVER_ERROR);
            assertTrue(decision.retry());
            assertEquals(attempt, decision.attempt());
            assertEquals(Duration.ofMillis(100), decision.delay());
        }
        RetryDecision last = retries.onFailure(page, CrawlErrorKind.SERVER_ERROR);
        assertFalse(last.retry());
        assertEquals(3, last.attempt());
        assertEquals(3, retries.attempts(page.key()));
    }

    @Test
    void permanentErrorsAreNeverRetried() {
        RetryDecision decision = retries.onFailure(new PageTask(1), CrawlErrorKind.PERMANENT);
        assertFalse(decision.retry());
        assertEquals(0, decision.attempt());
        assertEquals(0, retries.attempts("page:1"));
    }

    @Test
    void parseErrorsUseTheSmallerBudget() {
        PageTask page = new PageTask(2);
        assertTrue(retries.onFailure(page, CrawlErrorKind.PARSE_ERROR).retry());
        assertFalse(retries.onFailure(page, CrawlErrorKind.PARSE_ERROR).retry());
    }

    @Test
    void rateLimitedRetriesWaitTwiceAsLong() {
        RetryDecision decision = retries.onFailure(new PageTask(3), CrawlErrorKind.RATE_LIMITED);
        assertTrue(decision.retry());
        assertEquals(Duration.ofMillis(200), decision.delay());
    }

    @Test
    void seededAttemptsCountAgainstTheBudget() {
        retries.seed("page:4", 3);
        RetryDecision decision = retries.onFailure(new PageTask(4), CrawlErrorKind.NETWORK_TIMEOUT);
        assertFalse(decision.retry());
        assertEquals(3, retries.totalRetries());
    }

    @Test
    void failedSampleIsCappedButCountIsNot() {
        for (int page = 1; page <= 25; page++) {
            retries.recordPermanentFailure(PageTask.keyFor(page));
        }
        assertEquals(RetryManager.FAILED_SAMPLE_LIMIT, retries.failedSample().size());
        assertEquals("page:1", retries.failedSample().get(0));
        assertEquals(25, retries.permanentlyFailedCount());
    }

    @Test
    void histogramCountsTasksPerRetryCount() {
        retries.onFailure(new PageTask(1), CrawlErrorKind.SERVER_ERROR);
        retries.onFailure(new PageTask(2), CrawlErrorKind.SERVER_ERROR);
        retries.onFailure(new PageTask(2), CrawlErrorKind.SERVER_ERROR);
        retries.onFailure(new PageTask(3), CrawlErrorKind.SERVER_ERROR);

        assertEquals(Map.of(1, 2, 2, 1), retries.histogram());
        assertEquals(4, retries.totalRetries());
        assertEquals(CrawlErrorKind.SERVER_ERROR, retries.record("page:2").lastErrorKind());
    }
}
