package com.dharmil.catalogcrawl.akka.actor;

import akka.actor.AbstractActor;
import akka.actor.ActorRef;
import akka.actor.Cancellable;
import akka.actor.Props;
import akka.pattern.Patterns;
import com.dharmil.catalogcrawl.akka.messages.BatchFinished;
import com.dharmil.catalogcrawl.akka.messages.CrawlMessage;
import com.dharmil.catalogcrawl.akka.messages.DrainPhase;
import com.dharmil.catalogcrawl.akka.messages.PausePhase;
import com.dharmil.catalogcrawl.akka.messages.PhaseFinished;
import com.dharmil.catalogcrawl.akka.messages.PhaseProgress;
import com.dharmil.catalogcrawl.akka.messages.ResumePhase;
import com.dharmil.catalogcrawl.akka.messages.StartPhase;
import com.dharmil.catalogcrawl.events.CrawlEvent;
import com.dharmil.catalogcrawl.events.CrawlEventBroadcaster;
import com.dharmil.catalogcrawl.model.CrawlErrorKind;
import com.dharmil.catalogcrawl.model.CrawlTask;
import com.dharmil.catalogcrawl.model.DownshiftMeta;
import com.dharmil.catalogcrawl.model.PhaseKind;
import com.dharmil.catalogcrawl.model.PhaseResult;
import com.dharmil.catalogcrawl.model.PhaseSettings;
import com.dharmil.catalogcrawl.model.PhaseSnapshot;
import com.dharmil.catalogcrawl.model.ProductRef;
import com.dharmil.catalogcrawl.model.TaskOutcome;
import com.dharmil.catalogcrawl.service.ConcurrencyController;
import com.dharmil.catalogcrawl.service.PhaseLedger;
import com.dharmil.catalogcrawl.service.RetryDecision;
import com.dharmil.catalogcrawl.service.RetryManager;
import com.dharmil.catalogcrawl.service.TaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Drives one phase: admits the plan batch by batch, keeps at most {@code currentLimit} tasks in
 * flight, applies every outcome to the ledger (this actor is the only writer of phase state) and
 * reports progress, batch boundaries and the final {@link PhaseResult} to its parent session.
 */
public class PhaseCoordinatorActor extends AbstractActor {

    private static final Logger log = LoggerFactory.getLogger(PhaseCoordinatorActor.class);

    // --- Configuration ---
    private final String sessionId;
    private final PhaseSettings settings;
    private final TaskExecutor taskExecutor;
    private final String dispatcherId;
    private final CrawlEventBroadcaster events;
    private final Clock clock;

    // --- Phase State ---
    private enum PhaseStatus { IDLE, RUNNING, PAUSED, DRAINING, FINISHED }

    private PhaseStatus status = PhaseStatus.IDLE;
    private final Map<String, CrawlTask> tasksByKey = new LinkedHashMap<>();
    private final PhaseLedger ledger;
    private final RetryManager retryManager;
    private final ConcurrencyController concurrency;
    private Executor taskDispatcher;
    private Cancellable drainDeadline;
    private Instant startedAt;
    private Instant finishedAt;
    private long attempts;
    private long errorCount;
    private String lastError;
    private Instant lastErrorAt;

    // Internal messages
    private record TaskFinished(TaskOutcome outcome) implements CrawlMessage {}
    private record RetryEligible(String taskKey) implements CrawlMessage {}
    private record DrainDeadline() implements CrawlMessage {}

    /**
     * @param seededRetries retries already spent on tasks of this plan, keyed by task key
     */
    public static Props props(String sessionId, PhaseSettings settings, List<? extends CrawlTask> tasks,
                              Map<String, Integer> seededRetries, TaskExecutor taskExecutor,
                              String dispatcherId, CrawlEventBroadcaster events, Clock clock) {
        return Props.create(PhaseCoordinatorActor.class, () -> new PhaseCoordinatorActor(
                sessionId, settings, tasks, seededRetries, taskExecutor, dispatcherId, events, clock));
    }

    public PhaseCoordinatorActor(String sessionId, PhaseSettings settings, List<? extends CrawlTask> tasks,
                                 Map<String, Integer> seededRetries, TaskExecutor taskExecutor,
                                 String dispatcherId, CrawlEventBroadcaster events, Clock clock) {
        this.sessionId = sessionId;
        this.settings = settings;
        this.taskExecutor = taskExecutor;
        this.dispatcherId = dispatcherId;
        this.events = events;
        this.clock = clock;
        this.ledger = new PhaseLedger(settings.phase(), tasks, settings.batchSize());
        this.retryManager = new RetryManager(settings.maxRetries(), settings.parseErrorMaxRetries(), settings.retryDelay());
        this.concurrency = new ConcurrencyController(settings.concurrency(), settings.downshiftThreshold(),
                settings.downshiftFactor(), settings.downshiftMinSample(), clock);
        for (CrawlTask task : tasks) {
            tasksByKey.putIfAbsent(task.key(), task);
        }
        seededRetries.forEach((key, retries) -> {
            if (tasksByKey.containsKey(key)) {
                retryManager.seed(key, retries);
            }
        });
    }

    @Override
    public void preStart() throws Exception {
        super.preStart();
        this.taskDispatcher = getContext().getSystem().dispatchers().lookup(dispatcherId);
        log.info("[{}] {} coordinator ready: {} tasks, limit {}, batch size {}, dispatcher {}",
                sessionId, phase(), ledger.total(), concurrency.currentLimit(), settings.batchSize(), dispatcherId);
    }

    @Override
    public void postStop() throws Exception {
        cancelDrainDeadline();
        log.debug("[{}] {} coordinator stopped in state {}", sessionId, phase(), status);
        super.postStop();
    }

    // --- Receive Method ---
    @Override
    public Receive createReceive() {
        return receiveBuilder()
                .match(StartPhase.class, msg -> status == PhaseStatus.IDLE, this::handleStartPhase)
                .match(PausePhase.class, msg -> handlePause())
                .match(ResumePhase.class, msg -> handleResume())
                .match(DrainPhase.class, this::handleDrain)
                .match(TaskFinished.class, msg -> handleTaskFinished(msg.outcome()))
                .match(RetryEligible.class, this::handleRetryEligible)
                .match(DrainDeadline.class, msg -> handleDrainDeadline())
                .matchAny(this::handleUnknownMessage)
                .build();
    }

    // --- Message Handlers ---

    private void handleStartPhase(StartPhase msg) {
        startedAt = clock.instant();
        status = msg.paused() ? PhaseStatus.PAUSED : PhaseStatus.RUNNING;
        log.info("[{}] Starting {} with {} tasks (paused={})", sessionId, phase(), ledger.total(), msg.paused());
        events.publish(new CrawlEvent.PhaseStarted(sessionId, phase(), ledger.total(), concurrency.currentLimit()));
        if (ledger.isDone()) {
            finish(PhaseResult.Outcome.COMPLETED, "nothing to do");
            return;
        }
        admitNextBatch();
        reportProgress(List.of());
        dispatch();
    }

    private void handlePause() {
        if (status == PhaseStatus.RUNNING) {
            status = PhaseStatus.PAUSED;
            log.info("[{}] {} paused with {} tasks in flight", sessionId, phase(), ledger.inFlightCount());
        } else {
            log.debug("[{}] Ignoring pause of {} in state {}", sessionId, phase(), status);
        }
    }

    private void handleResume() {
        if (status == PhaseStatus.PAUSED) {
            status = PhaseStatus.RUNNING;
            log.info("[{}] {} resumed at limit {}", sessionId, phase(), concurrency.currentLimit());
            dispatch();
        } else {
            log.debug("[{}] Ignoring resume of {} in state {}", sessionId, phase(), status);
        }
    }

    private void handleDrain(DrainPhase msg) {
        if (status == PhaseStatus.FINISHED || status == PhaseStatus.DRAINING) {
            log.debug("[{}] Ignoring drain of {} in state {}", sessionId, phase(), status);
            return;
        }
        if (status == PhaseStatus.IDLE) {
            startedAt = clock.instant();
        }
        status = PhaseStatus.DRAINING;
        int inFlight = ledger.inFlightCount();
        log.info("[{}] Draining {}: waiting up to {} for {} in-flight tasks", sessionId, phase(), msg.timeout(), inFlight);
        if (inFlight == 0) {
            finish(PhaseResult.Outcome.ABORTED, "shutdown requested");
            return;
        }
        drainDeadline = getContext().getSystem().scheduler().scheduleOnce(
                msg.timeout(), getSelf(), new DrainDeadline(),
                getContext().getDispatcher(), ActorRef.noSender());
    }

    private void handleDrainDeadline() {
        if (status != PhaseStatus.DRAINING) {
            return;
        }
        List<CrawlTask> abandoned = ledger.forceFailInFlight();
        for (CrawlTask task : abandoned) {
            retryManager.recordPermanentFailure(task.key());
            recordError(CrawlErrorKind.INTERNAL_ERROR, task.key() + ": abandoned at shutdown");
        }
        log.warn("[{}] Drain deadline reached for {}; {} in-flight tasks recorded as permanently failed",
                sessionId, phase(), abandoned.size());
        reportProgress(List.of());
        finish(PhaseResult.Outcome.ABORTED, abandoned.size() + " tasks abandoned at shutdown");
    }

    private void handleRetryEligible(RetryEligible msg) {
        if (status == PhaseStatus.FINISHED || status == PhaseStatus.DRAINING) {
            return;
        }
        if (ledger.markRetryEligible(msg.taskKey())) {
            log.debug("[{}] {} eligible for retry", sessionId, msg.taskKey());
            dispatch();
        }
    }

    private void handleTaskFinished(TaskOutcome outcome) {
        String key = outcome.task().key();
        if (status == PhaseStatus.FINISHED || !ledger.isInFlight(key)) {
            log.debug("[{}] Ignoring late outcome {} for {}", sessionId, outcome.status(), key);
            return;
        }
        ledger.recordResult(key, outcome.resultState());
        List<ProductRef> discovered = List.of();
        if (outcome.isSuccess()) {
            ledger.markCompleted(key);
            discovered = outcome.discovered();
            log.debug("[{}] {} completed in {} ms ({} refs)", sessionId, key, outcome.durationMs(), discovered.size());
            events.publish(new CrawlEvent.TaskCompleted(sessionId, phase(), key, outcome.durationMs()));
        } else {
            applyFailure(outcome);
        }

        Optional<DownshiftMeta> downshift = concurrency.observe(ledger.succeeded(), ledger.failed());
        downshift.ifPresent(meta -> {
            log.warn("[{}] {} concurrency downshifted {} -> {} ({})",
                    sessionId, phase(), meta.oldLimit(), meta.newLimit(), meta.trigger());
            events.publish(new CrawlEvent.ConcurrencyDownshifted(sessionId, phase(), meta));
        });

        reportProgress(discovered);

        if (ledger.failed() >= settings.failureThreshold()) {
            log.error("[{}] {} reached failure threshold: {} permanently failed (threshold {})",
                    sessionId, phase(), ledger.failed(), settings.failureThreshold());
            finish(PhaseResult.Outcome.THRESHOLD_EXCEEDED,
                    "failure threshold " + settings.failureThreshold() + " reached");
            return;
        }
        if (ledger.isDone()) {
            completeBatch();
            finish(PhaseResult.Outcome.COMPLETED, null);
            return;
        }
        if (status == PhaseStatus.DRAINING) {
            if (ledger.inFlightCount() == 0) {
                finish(PhaseResult.Outcome.ABORTED, "shutdown requested");
            }
            return;
        }
        if (ledger.currentBatchDone()) {
            completeBatch();
            admitNextBatch();
        }
        dispatch();
    }

    private void handleUnknownMessage(Object msg) {
        if (status == PhaseStatus.FINISHED) {
            log.debug("Ignoring message {} as {} is already finished.", msg.getClass().getSimpleName(), phase());
            return;
        }
        log.warn("Received unknown message: {} from {}", msg.getClass().getName(), getSender());
    }

    // --- Helper Methods ---

    private void applyFailure(TaskOutcome outcome) {
        CrawlTask task = outcome.task();
        String key = task.key();
        recordError(outcome.errorKind(), key + ": " + outcome.error());
        RetryDecision decision = retryManager.onFailure(task, outcome.errorKind());
        if (decision.retry()) {
            ledger.markRetrying(key);
            events.publish(new CrawlEvent.TaskFailed(sessionId, phase(), key, outcome.errorKind(), outcome.error(),
                    true, decision.attempt()));
            if (status == PhaseStatus.DRAINING) {
                log.debug("[{}] {} failed while draining; left for the next session", sessionId, key);
                return;
            }
            log.warn("[{}] {} failed ({}: {}); retry {}/{} in {} ms", sessionId, key, outcome.errorKind(),
                    outcome.error(), decision.attempt(), retryManager.maxRetries(), decision.delay().toMillis());
            scheduleRetry(key, decision.delay());
        } else {
            ledger.markPermanentlyFailed(key);
            retryManager.recordPermanentFailure(key);
            log.warn("[{}] {} permanently failed ({}: {}): {}", sessionId, key, outcome.errorKind(),
                    outcome.error(), decision.reason());
            events.publish(new CrawlEvent.TaskFailed(sessionId, phase(), key, outcome.errorKind(), outcome.error(),
                    false, decision.attempt()));
        }
    }

    private void scheduleRetry(String key, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            getSelf().tell(new RetryEligible(key), getSelf());
            return;
        }
        getContext().getSystem().scheduler().scheduleOnce(
                delay, getSelf(), new RetryEligible(key),
                getContext().getDispatcher(), ActorRef.noSender());
    }

    /**
     * Fills free slots, fresh work first, then retry-eligible work.
     */
    private void dispatch() {
        while (status == PhaseStatus.RUNNING && ledger.inFlightCount() < concurrency.currentLimit()) {
            Optional<CrawlTask> next = ledger.nextDispatchable();
            if (next.isEmpty()) {
                return;
            }
            CrawlTask task = next.get();
            attempts++;
            int attempt = retryManager.attempts(task.key()) + 1;
            log.debug("[{}] Dispatching {} (attempt {}), {} in flight", sessionId, task.key(), attempt, ledger.inFlightCount());
            events.publish(new CrawlEvent.TaskStarted(sessionId, phase(), task.key(), attempt));
            CompletionStage<TaskFinished> finished = taskExecutor
                    .execute(task, settings.taskTimeout(), taskDispatcher)
                    .thenApply(TaskFinished::new);
            Patterns.pipe(finished, getContext().getDispatcher()).to(getSelf());
        }
    }

    private void admitNextBatch() {
        if (!ledger.hasUnadmitted()) {
            return;
        }
        List<CrawlTask> admitted = ledger.admitNextBatch();
        log.info("[{}] {} batch {} admitted ({} tasks)", sessionId, phase(), ledger.batchIndex(), admitted.size());
        events.publish(new CrawlEvent.BatchStarted(sessionId, phase(), ledger.batchIndex(), admitted.size()));
    }

    private void completeBatch() {
        int batchIndex = ledger.batchIndex();
        log.info("[{}] {} batch {} completed ({} succeeded, {} failed so far)",
                sessionId, phase(), batchIndex, ledger.succeeded(), ledger.failed());
        events.publish(new CrawlEvent.BatchCompleted(sessionId, phase(), batchIndex));
        getContext().getParent().tell(new BatchFinished(phase(), batchIndex, snapshot(true)), getSelf());
    }

    private void finish(PhaseResult.Outcome outcome, String reason) {
        status = PhaseStatus.FINISHED;
        finishedAt = clock.instant();
        cancelDrainDeadline();
        PhaseSnapshot snapshot = snapshot(true);
        if (outcome == PhaseResult.Outcome.COMPLETED) {
            log.info("[{}] {} completed: {} succeeded, {} failed, {} retries",
                    sessionId, phase(), snapshot.succeeded(), snapshot.failed(), snapshot.totalRetries());
            events.publish(new CrawlEvent.PhaseCompleted(sessionId, phase(), snapshot.succeeded(), snapshot.failed()));
        } else {
            log.warn("[{}] {} finished with {}: {}", sessionId, phase(), outcome, reason);
            events.publish(new CrawlEvent.PhaseAborted(sessionId, phase(), outcome + ": " + reason));
        }
        getContext().getParent().tell(new PhaseFinished(new PhaseResult(phase(), outcome, snapshot, reason)), getSelf());
    }

    private void reportProgress(List<ProductRef> discovered) {
        getContext().getParent().tell(new PhaseProgress(snapshot(false), discovered), getSelf());
    }

    private void recordError(CrawlErrorKind kind, String message) {
        errorCount++;
        lastError = kind + " " + message;
        lastErrorAt = clock.instant();
    }

    /**
     * @param withTasks include the task lists and retry counts, which cost a walk over the phase
     */
    private PhaseSnapshot snapshot(boolean withTasks) {
        Map<CrawlTask, Integer> retryCounts = null;
        if (withTasks) {
            retryCounts = new LinkedHashMap<>();
            for (String key : retryManager.retriedKeys()) {
                retryCounts.put(tasksByKey.get(key), retryManager.attempts(key));
            }
        }
        return new PhaseSnapshot(
                phase(),
                ledger.total(),
                ledger.succeeded(),
                ledger.failed(),
                ledger.retrying(),
                ledger.inFlightCount(),
                ledger.queuedCount(),
                settings.failureThreshold(),
                retryManager.failedSample(),
                concurrency.state(),
                attempts,
                errorCount,
                lastError,
                lastErrorAt,
                startedAt,
                finishedAt,
                withTasks ? ledger.unfinishedTasks() : null,
                withTasks ? ledger.failedTasks() : null,
                withTasks ? ledger.retryingTasks() : null,
                retryCounts,
                retryManager.histogram(),
                retryManager.totalRetries(),
                ledger.batchIndex());
    }

    private void cancelDrainDeadline() {
        if (drainDeadline != null) {
            drainDeadline.cancel();
            drainDeadline = null;
        }
    }

    private PhaseKind phase() {
        return settings.phase();
    }
}
