package com.dharmil.catalogcrawl.events;

import com.dharmil.catalogcrawl.model.CrawlErrorKind;
import com.dharmil.catalogcrawl.model.DownshiftMeta;
import com.dharmil.catalogcrawl.model.PhaseKind;

/**
 * Internal event model. Every wire format is rendered from these records by {@link EventWireFormat}.
 */
public interface CrawlEvent {

    String sessionId();

    /** Stable variant name used by the generalized wire format. */
    default String variant() {
        return getClass().getSimpleName();
    }

    /** Per-variant event name used by the legacy wire format. */
    String legacyName();

    private static String phaseScoped(PhaseKind phase, String suffix) {
        return "actor-" + phase.taskPrefix() + "-" + suffix;
    }

    // --- Session lifecycle ---

    record SessionStarted(String sessionId, int totalPages, boolean resumed) implements CrawlEvent {
        public String legacyName() { return "actor-session-started"; }
    }

    record SessionPaused(String sessionId) implements CrawlEvent {
        public String legacyName() { return "actor-session-paused"; }
    }

    record SessionResumed(String sessionId) implements CrawlEvent {
        public String legacyName() { return "actor-session-resumed"; }
    }

    record SessionCompleted(String sessionId, long pagesProcessed, long detailsProcessed, long elapsedMs)
            implements CrawlEvent {
        public String legacyName() { return "actor-session-completed"; }
    }

    record SessionFailed(String sessionId, String reason) implements CrawlEvent {
        public String legacyName() { return "actor-session-failed"; }
    }

    record ShutdownRequested(String sessionId) implements CrawlEvent {
        public String legacyName() { return "actor-shutdown-requested"; }
    }

    record ShutdownCompleted(String sessionId, int remainingTasks) implements CrawlEvent {
        public String legacyName() { return "actor-shutdown-completed"; }
    }

    // --- Phases and batches ---

    record PhaseStarted(String sessionId, PhaseKind phase, int total, int concurrencyLimit) implements CrawlEvent {
        public String legacyName() { return "actor-phase-started"; }
    }

    record PhaseCompleted(String sessionId, PhaseKind phase, int succeeded, int failed) implements CrawlEvent {
        public String legacyName() { return "actor-phase-completed"; }
    }

    record PhaseAborted(String sessionId, PhaseKind phase, String reason) implements CrawlEvent {
        public String legacyName() { return "actor-phase-aborted"; }
    }

    record BatchStarted(String sessionId, PhaseKind phase, int batchIndex, int size) implements CrawlEvent {
        public String legacyName() { return "actor-batch-started"; }
    }

    record BatchCompleted(String sessionId, PhaseKind phase, int batchIndex) implements CrawlEvent {
        public String legacyName() { return "actor-batch-completed"; }
    }

    // --- Tasks ---

    record TaskStarted(String sessionId, PhaseKind phase, String taskKey, int attempt) implements CrawlEvent {
        public String legacyName() { return phaseScoped(phase, "task-started"); }
    }

    record TaskCompleted(String sessionId, PhaseKind phase, String taskKey, long durationMs) implements CrawlEvent {
        public String legacyName() { return phaseScoped(phase, "task-completed"); }
    }

    record TaskFailed(String sessionId, PhaseKind phase, String taskKey, CrawlErrorKind errorKind, String error,
                      boolean willRetry, int attempt) implements CrawlEvent {
        public String legacyName() { return phaseScoped(phase, "task-failed"); }
    }

    record ConcurrencyDownshifted(String sessionId, PhaseKind phase, DownshiftMeta downshift) implements CrawlEvent {
        public String legacyName() { return phaseScoped(phase, "concurrency-downshifted"); }
    }

    record ResumeTokenEmitted(String sessionId, boolean checkpoint, int remainingPages, String planHash)
            implements CrawlEvent {
        public String legacyName() { return "actor-resume-token-emitted"; }
    }
}
