package com.dharmil.catalogcrawl.service;

import com.dharmil.catalogcrawl.model.CrawlErrorKind;
import com.dharmil.catalogcrawl.model.CrawlTask;
import com.dharmil.catalogcrawl.model.RetryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-phase retry bookkeeping. Decides requeue vs. permanent failure and keeps attempt counts,
 * the retry histogram and a capped sample of permanently failed task keys.
 * <p>
 * Not thread-safe: owned by exactly one phase coordinator.
 */
public class RetryManager {

    private static final Logger log = LoggerFactory.getLogger(RetryManager.class);

    public static final int FAILED_SAMPLE_LIMIT = 20;

    public enum Classification { TRANSIENT, RATE_LIMITED, PERMANENT }

    private final int maxRetries;
    private final int parseErrorMaxRetries;
    private final RetryDelayStrategy delayStrategy;

    private final Map<String, RetryRecord> records = new LinkedHashMap<>();
    private final List<String> failedSample = new ArrayList<>();
    private long permanentlyFailed;
    private long totalRetries;

    public RetryManager(int maxRetries, int parseErrorMaxRetries, RetryDelayStrategy delayStrategy) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 but was " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.parseErrorMaxRetries = Math.max(0, parseErrorMaxRetries);
        this.delayStrategy = delayStrategy;
    }

    public static Classification classify(CrawlErrorKind kind) {
        return switch (kind) {
            case RATE_LIMITED -> Classification.RATE_LIMITED;
            case NETWORK_TIMEOUT, SERVER_ERROR, PARSE_ERROR -> Classification.TRANSIENT;
            case PERMANENT, INTERNAL_ERROR -> Classification.PERMANENT;
        };
    }

    /**
     * Restores retry counts carried over from a resume token.
     */
    public void seed(String taskKey, int attempts) {
        if (attempts > 0) {
            RetryRecord previous = records.put(taskKey, new RetryRecord(taskKey, attempts, null));
            totalRetries += attempts - (previous == null ? 0 : previous.attempts());
        }
    }

    public RetryDecision onFailure(CrawlTask task, CrawlErrorKind kind) {
        String key = task.key();
        int used = attempts(key);
        if (classify(kind) == Classification.PERMANENT) {
            return giveUp(key, used, kind, kind + " is not retryable");
        }
        int budget = kind == CrawlErrorKind.PARSE_ERROR ? Math.min(maxRetries, parseErrorMaxRetries) : maxRetries;
        if (used >= budget) {
            return giveUp(key, used, kind, "retry budget of " + budget + " exhausted");
        }
        RetryRecord next = records.getOrDefault(key, new RetryRecord(key, 0, null)).next(kind);
        records.put(key, next);
        totalRetries++;
        return RetryDecision.retryAfter(next.attempts(), delayStrategy.delayFor(next.attempts(), kind), kind);
    }

    /**
     * Counts a task that will not be retried, either because the budget ran out or because it
     * was abandoned at shutdown.
     */
    public void recordPermanentFailure(String taskKey) {
        permanentlyFailed++;
        if (failedSample.size() < FAILED_SAMPLE_LIMIT) {
            failedSample.add(taskKey);
        }
    }

    private RetryDecision giveUp(String key, int used, CrawlErrorKind kind, String reason) {
        log.debug("Giving up on {} after {} retries: {}", key, used, reason);
        return RetryDecision.giveUp(used, kind, reason);
    }

    public int attempts(String taskKey) {
        RetryRecord record = records.get(taskKey);
        return record == null ? 0 : record.attempts();
    }

    public RetryRecord record(String taskKey) {
        return records.get(taskKey);
    }

    /** retries → number of tasks that needed exactly that many retries. */
    public Map<Integer, Integer> histogram() {
        Map<Integer, Integer> histogram = new TreeMap<>();
        for (RetryRecord record : records.values()) {
            histogram.merge(record.attempts(), 1, Integer::sum);
        }
        return histogram;
    }

    public long totalRetries() {
        return totalRetries;
    }

    /** Keys of tasks granted at least one retry, in the order they were first retried. */
    public Set<String> retriedKeys() {
        return Collections.unmodifiableSet(records.keySet());
    }

    public List<String> failedSample() {
        return Collections.unmodifiableList(failedSample);
    }

    public long permanentlyFailedCount() {
        return permanentlyFailed;
    }

    public int maxRetries() {
        return maxRetries;
    }
}
