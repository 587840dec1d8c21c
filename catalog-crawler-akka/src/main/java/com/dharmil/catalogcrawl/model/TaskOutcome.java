package com.dharmil.catalogcrawl.model;

import java.util.List;

/**
 * Typed result of executing one task.
 *
 * @param task        the task that ran
 * @param status      success, failure or timeout
 * @param discovered  product references found by a list page task (empty otherwise)
 * @param errorKind   classified failure, {@code null} on success
 * @param error       failure message, {@code null} on success
 * @param durationMs  wall time of the attempt
 */
public record TaskOutcome(CrawlTask task,
                          Status status,
                          List<ProductRef> discovered,
                          CrawlErrorKind errorKind,
                          String error,
                          long durationMs) {

    public enum Status { SUCCEEDED, FAILED, TIMED_OUT }

    public TaskOutcome {
        discovered = discovered == null ? List.of() : List.copyOf(discovered);
    }

    public static TaskOutcome succeeded(CrawlTask task, List<ProductRef> discovered, long durationMs) {
        return new TaskOutcome(task, Status.SUCCEEDED, discovered, null, null, durationMs);
    }

    public static TaskOutcome failed(CrawlTask task, CrawlErrorKind kind, String error, long durationMs) {
        return new TaskOutcome(task, Status.FAILED, List.of(), kind, error, durationMs);
    }

    public static TaskOutcome timedOut(CrawlTask task, String error, long durationMs) {
        return new TaskOutcome(task, Status.TIMED_OUT, List.of(), CrawlErrorKind.NETWORK_TIMEOUT, error, durationMs);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    public TaskState resultState() {
        return switch (status) {
            case SUCCEEDED -> TaskState.SUCCEEDED;
            case FAILED -> TaskState.FAILED;
            case TIMED_OUT -> TaskState.TIMED_OUT;
        };
    }
}
