package com.dharmil.catalogcrawl.service;

import com.dharmil.catalogcrawl.model.CrawlTask;
import com.dharmil.catalogcrawl.model.PhaseKind;
import com.dharmil.catalogcrawl.model.TaskState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Task states and queues of one phase.
 * <p>
 * The plan is admitted {@code batchSize} tasks at a time. Within the admitted work, fresh tasks
 * are dispatched before retry-eligible ones, FIFO inside each queue. Every state change goes
 * through {@link TaskState#canTransitionTo}; an illegal move throws {@link IllegalStateException}.
 * <p>
 * Not thread-safe: owned by exactly one phase coordinator.
 */
public class PhaseLedger {

    private static final class Entry {
        private final CrawlTask task;
        private TaskState state = TaskState.QUEUED;

        private Entry(CrawlTask task) {
            this.task = task;
        }
    }

    private final PhaseKind phase;
    private final int batchSize;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private final Deque<CrawlTask> unadmitted = new ArrayDeque<>();
    private final Deque<CrawlTask> fresh = new ArrayDeque<>();
    private final Deque<CrawlTask> retryReady = new ArrayDeque<>();
    private final Set<String> inFlight = new LinkedHashSet<>();
    private final List<CrawlTask> failedTasks = new ArrayList<>();

    private int succeeded;
    private int failed;
    private int retrying;
    private int batchIndex = -1;

    public PhaseLedger(PhaseKind phase, List<? extends CrawlTask> tasks, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1 but was " + batchSize);
        }
        this.phase = phase;
        this.batchSize = batchSize;
        for (CrawlTask task : tasks) {
            if (task.phase() != phase) {
                throw new IllegalArgumentException("Task " + task.key() + " does not belong to phase " + phase);
            }
            if (entries.putIfAbsent(task.key(), new Entry(task)) == null) {
                unadmitted.add(task);
            }
        }
    }

    // --- Batches ---

    public boolean hasUnadmitted() {
        return !unadmitted.isEmpty();
    }

    /**
     * Moves the next {@code batchSize} planned tasks into the fresh queue.
     */
    public List<CrawlTask> admitNextBatch() {
        List<CrawlTask> admitted = new ArrayList<>(batchSize);
        while (admitted.size() < batchSize && !unadmitted.isEmpty()) {
            CrawlTask task = unadmitted.poll();
            fresh.add(task);
            admitted.add(task);
        }
        if (!admitted.isEmpty()) {
            batchIndex++;
        }
        return admitted;
    }

    /** True when the admitted work has no queued, in-flight or retrying task left. */
    public boolean currentBatchDone() {
        return fresh.isEmpty() && inFlight.isEmpty() && retrying == 0;
    }

    public int batchIndex() {
        return Math.max(0, batchIndex);
    }

    // --- Dispatch ---

    public Optional<CrawlTask> nextDispatchable() {
        CrawlTask next = fresh.poll();
        if (next == null) {
            next = retryReady.poll();
        }
        if (next == null) {
            return Optional.empty();
        }
        Entry entry = entry(next.key());
        if (entry.state == TaskState.RETRYING) {
            retrying--;
        }
        transition(entry, TaskState.DISPATCHED);
        inFlight.add(next.key());
        return Optional.of(next);
    }

    public boolean isInFlight(String key) {
        return inFlight.contains(key);
    }

    // --- Outcomes ---

    /**
     * Applies the raw result of an attempt ({@code SUCCEEDED}, {@code FAILED} or {@code TIMED_OUT}).
     */
    public void recordResult(String key, TaskState result) {
        Entry entry = entry(key);
        transition(entry, result);
        inFlight.remove(key);
    }

    public void markCompleted(String key) {
        transition(entry(key), TaskState.COMPLETED);
        succeeded++;
    }

    /** Parks a failed task until its retry delay elapses. */
    public void markRetrying(String key) {
        transition(entry(key), TaskState.RETRYING);
        retrying++;
    }

    /**
     * Puts a parked task at the back of the retry queue.
     *
     * @return false when the task is no longer waiting for a retry
     */
    public boolean markRetryEligible(String key) {
        Entry entry = entries.get(key);
        if (entry == null || entry.state != TaskState.RETRYING || retryReady.contains(entry.task)) {
            return false;
        }
        retryReady.add(entry.task);
        return true;
    }

    public void markPermanentlyFailed(String key) {
        Entry entry = entry(key);
        transition(entry, TaskState.PERMANENTLY_FAILED);
        failed++;
        failedTasks.add(entry.task);
    }

    /**
     * Records every in-flight task as failed for good. Used when a drain deadline passes.
     *
     * @return the abandoned tasks
     */
    public List<CrawlTask> forceFailInFlight() {
        List<CrawlTask> abandoned = new ArrayList<>();
        for (String key : new ArrayList<>(inFlight)) {
            recordResult(key, TaskState.FAILED);
            markPermanentlyFailed(key);
            abandoned.add(entry(key).task);
        }
        return abandoned;
    }

    // --- Queries ---

    public boolean isDone() {
        return succeeded + failed == entries.size();
    }

    public TaskState stateOf(String key) {
        return entry(key).state;
    }

    public PhaseKind phase() {
        return phase;
    }

    public int total() {
        return entries.size();
    }

    public int succeeded() {
        return succeeded;
    }

    public int failed() {
        return failed;
    }

    public int retrying() {
        return retrying;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /** Tasks not yet dispatched, admitted or not. */
    public int queuedCount() {
        return fresh.size() + unadmitted.size();
    }

    /** Every task that is neither completed nor permanently failed, in plan order. */
    public List<CrawlTask> unfinishedTasks() {
        List<CrawlTask> unfinished = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (!entry.state.isTerminal()) {
                unfinished.add(entry.task);
            }
        }
        return unfinished;
    }

    public List<CrawlTask> failedTasks() {
        return Collections.unmodifiableList(failedTasks);
    }

    public List<CrawlTask> retryingTasks() {
        List<CrawlTask> parked = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (entry.state == TaskState.RETRYING) {
                parked.add(entry.task);
            }
        }
        return parked;
    }

    private Entry entry(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown task " + key + " in phase " + phase);
        }
        return entry;
    }

    private void transition(Entry entry, TaskState next) {
        if (!entry.state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + entry.state + " -> " + next
                    + " for task " + entry.task.key());
        }
        entry.state = next;
    }
}
