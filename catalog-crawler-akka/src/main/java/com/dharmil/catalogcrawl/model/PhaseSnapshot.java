package com.dharmil.catalogcrawl.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable point-in-time copy of a phase's progress, produced by its coordinator after every
 * applied outcome. Everything outside the coordinator reads phases through these snapshots.
 * <p>
 * Per-outcome snapshots carry counters only. The task lists and retry counts are filled in at
 * batch boundaries and when the phase finishes, see {@link #withTaskListsFrom(PhaseSnapshot)}.
 *
 * @param succeeded        tasks that reached {@code COMPLETED}
 * @param failed           tasks that reached {@code PERMANENTLY_FAILED}
 * @param retrying         tasks waiting for (or eligible for) another attempt
 * @param failedSample     first permanently failed task keys, capped for reporting
 * @param unfinishedTasks  every task that is neither completed nor permanently failed
 * @param failedTasks      every permanently failed task, in failure order
 * @param retryingTasks    tasks parked in {@code RETRYING}
 * @param retryCounts      retries granted per task, only tasks with at least one retry
 * @param retryHistogram   retries → number of tasks that needed that many retries
 * @param batchIndex       zero-based index of the batch currently admitted
 */
public record PhaseSnapshot(PhaseKind phase,
                            int total,
                            int succeeded,
                            int failed,
                            int retrying,
                            int inFlight,
                            int queued,
                            int failureThreshold,
                            List<String> failedSample,
                            ConcurrencyState concurrency,
                            long attempts,
                            long errorCount,
                            String lastError,
                            Instant lastErrorAt,
                            Instant startedAt,
                            Instant finishedAt,
                            List<CrawlTask> unfinishedTasks,
                            List<CrawlTask> failedTasks,
                            List<CrawlTask> retryingTasks,
                            Map<CrawlTask, Integer> retryCounts,
                            Map<Integer, Integer> retryHistogram,
                            long totalRetries,
                            int batchIndex) {

    public PhaseSnapshot {
        failedSample = failedSample == null ? List.of() : List.copyOf(failedSample);
        unfinishedTasks = unfinishedTasks == null ? List.of() : List.copyOf(unfinishedTasks);
        failedTasks = failedTasks == null ? List.of() : List.copyOf(failedTasks);
        retryingTasks = retryingTasks == null ? List.of() : List.copyOf(retryingTasks);
        retryCounts = retryCounts == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(retryCounts));
        retryHistogram = retryHistogram == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(retryHistogram));
    }

    /**
     * Snapshot of a phase that has been planned but has not applied any outcome yet.
     */
    public static PhaseSnapshot initial(PhaseKind phase, List<? extends CrawlTask> tasks,
                                        int failureThreshold, int concurrencyLimit, Instant startedAt) {
        return new PhaseSnapshot(phase, tasks.size(), 0, 0, 0, 0, tasks.size(), failureThreshold,
                List.of(), new ConcurrencyState(concurrencyLimit, false, null),
                0, 0, null, null, startedAt, null,
                List.copyOf(tasks), List.of(), List.of(), Map.of(), Map.of(), 0, 0);
    }

    /**
     * This snapshot's counters with the task lists and retry counts of {@code previous}, for
     * progress snapshots that were taken without them.
     */
    public PhaseSnapshot withTaskListsFrom(PhaseSnapshot previous) {
        if (previous == null) {
            return this;
        }
        return new PhaseSnapshot(phase, total, succeeded, failed, retrying, inFlight, queued, failureThreshold,
                failedSample, concurrency, attempts, errorCount, lastError, lastErrorAt, startedAt, finishedAt,
                previous.unfinishedTasks, previous.failedTasks, previous.retryingTasks, previous.retryCounts,
                retryHistogram, totalRetries, batchIndex);
    }

    /** Outcomes applied so far: {@code succeeded + failed}. */
    public int processed() {
        return succeeded + failed;
    }

    public double failedRate() {
        int processed = processed();
        return processed == 0 ? 0.0 : (double) failed / processed;
    }

    public double percent() {
        return total == 0 ? 0.0 : processed() * 100.0 / total;
    }

    public boolean isFinished() {
        return finishedAt != null;
    }
}
