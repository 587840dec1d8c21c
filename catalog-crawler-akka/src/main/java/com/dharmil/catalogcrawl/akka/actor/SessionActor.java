package com.dharmil.catalogcrawl.akka.actor;

import akka.actor.AbstractActor;
import akka.actor.ActorRef;
import akka.actor.OneForOneStrategy;
import akka.actor.Props;
import akka.actor.SupervisorStrategy;
import akka.actor.Terminated;
import akka.japi.pf.DeciderBuilder;
import com.dharmil.catalogcrawl.akka.messages.BatchFinished;
import com.dharmil.catalogcrawl.akka.messages.CommandAccepted;
import com.dharmil.catalogcrawl.akka.messages.CommandRejected;
import com.dharmil.catalogcrawl.akka.messages.CrawlMessage;
import com.dharmil.catalogcrawl.akka.messages.DrainPhase;
import com.dharmil.catalogcrawl.akka.messages.GetStatus;
import com.dharmil.catalogcrawl.akka.messages.PausePhase;
import com.dharmil.catalogcrawl.akka.messages.PauseSession;
import com.dharmil.catalogcrawl.akka.messages.PhaseFinished;
import com.dharmil.catalogcrawl.akka.messages.PhaseProgress;
import com.dharmil.catalogcrawl.akka.messages.RequestShutdown;
import com.dharmil.catalogcrawl.akka.messages.ResumePhase;
import com.dharmil.catalogcrawl.akka.messages.ResumeTokenWriteFailed;
import com.dharmil.catalogcrawl.akka.messages.ResumeSession;
import com.dharmil.catalogcrawl.akka.messages.SessionStatusChanged;
import com.dharmil.catalogcrawl.akka.messages.StartPhase;
import com.dharmil.catalogcrawl.akka.messages.WriteResumeToken;
import com.dharmil.catalogcrawl.events.CrawlEvent;
import com.dharmil.catalogcrawl.model.CrawlTask;
import com.dharmil.catalogcrawl.model.DetailTask;
import com.dharmil.catalogcrawl.model.PageTask;
import com.dharmil.catalogcrawl.model.PhaseKind;
import com.dharmil.catalogcrawl.model.PhaseResult;
import com.dharmil.catalogcrawl.model.PhaseSettings;
import com.dharmil.catalogcrawl.model.PhaseSnapshot;
import com.dharmil.catalogcrawl.model.ProductRef;
import com.dharmil.catalogcrawl.model.RestorePlan;
import com.dharmil.catalogcrawl.model.ResumeToken;
import com.dharmil.catalogcrawl.model.SessionConfig;
import com.dharmil.catalogcrawl.model.SessionStatus;
import com.dharmil.catalogcrawl.model.SessionStatusView;
import com.dharmil.catalogcrawl.model.SessionSummary;
import com.dharmil.catalogcrawl.resume.PlanHashes;
import com.dharmil.catalogcrawl.resume.ResumeTokenManager;
import com.dharmil.catalogcrawl.service.CrawlRuntime;
import com.dharmil.catalogcrawl.service.StatusAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns one crawl session: runs the list phase and then the detail phase through a
 * {@link PhaseCoordinatorActor} child, arbitrates pause/resume/shutdown, emits resume tokens and
 * answers status queries from the latest phase snapshots. Tokens are stored by a
 * {@link ResumeTokenWriterActor} child on the blocking dispatcher.
 * <p>
 * Lifecycle: {@code Running -> {Paused <-> Running} -> {Completed | Failed} -> ShuttingDown}.
 * A terminal session stays queryable for {@code removalGrace} and then stops itself.
 */
public class SessionActor extends AbstractActor {

    private static final Logger log = LoggerFactory.getLogger(SessionActor.class);

    // --- Configuration ---
    private final String sessionId;
    private final SessionConfig config;
    private final RestorePlan restorePlan;
    private final CrawlRuntime runtime;
    private final String planHash;
    private final long processedOffset;
    private final long totalPages;

    // --- Session State ---
    private SessionStatus status = SessionStatus.RUNNING;
    private Instant startedAt;
    private Instant completedAt;
    private PhaseSnapshot pages;
    private PhaseSnapshot details;
    private boolean detailPhaseStarted;
    private final Map<String, ProductRef> discovered = new LinkedHashMap<>();
    private ActorRef coordinator;
    private ActorRef tokenWriter;
    private PhaseKind activePhase;
    private boolean shutdownRequested;
    private String latestToken;
    private List<Integer> latestTokenPages;

    // Internal message for delayed removal
    private record RemoveAfterGrace() implements CrawlMessage {}

    public static Props props(SessionConfig config, RestorePlan restorePlan, CrawlRuntime runtime) {
        return Props.create(SessionActor.class, () -> new SessionActor(config, restorePlan, runtime));
    }

    public SessionActor(SessionConfig config, RestorePlan restorePlan, CrawlRuntime runtime) {
        if (config.sessionId() == null) {
            throw new IllegalArgumentException("SessionConfig must carry a session id");
        }
        this.sessionId = config.sessionId();
        this.restorePlan = restorePlan;
        this.runtime = runtime;
        if (restorePlan != null) {
            this.config = config.toBuilder()
                    .pages(restorePlan.remainingPages())
                    .batchSize(restorePlan.batchSize())
                    .listConcurrency(restorePlan.concurrencyLimit())
                    .build();
            this.planHash = restorePlan.planHash();
            this.processedOffset = restorePlan.processedPages();
            this.totalPages = restorePlan.totalPages();
            for (String id : restorePlan.remainingDetailIds()) {
                discovered.putIfAbsent(id, new ProductRef(id, this.config.detailUrlFor(id)));
            }
        } else {
            this.config = config;
            this.planHash = PlanHashes.of(config.pages(), config.batchSize());
            this.processedOffset = 0;
            this.totalPages = config.pages().size();
        }
    }

    @Override
    public void preStart() throws Exception {
        super.preStart();
        startedAt = runtime.clock().instant();
        tokenWriter = getContext().actorOf(
                ResumeTokenWriterActor.props(runtime.tokenStore(), runtime.dispatcherId()), "token-writer");
        log.info("[{}] Session started: {} pages (of {} total), batch size {}, plan {}{}",
                sessionId, config.pages().size(), totalPages, config.batchSize(), planHash,
                restorePlan != null ? ", resumed from v" + restorePlan.version() + " token" : "");
        runtime.events().publish(new CrawlEvent.SessionStarted(sessionId, config.pages().size(), restorePlan != null));
        pages = PhaseSnapshot.initial(PhaseKind.LIST_COLLECTION, pageTasks(), config.pageFailureThreshold(),
                config.listConcurrency(), null);
        details = PhaseSnapshot.initial(PhaseKind.DETAIL_COLLECTION, List.of(), config.detailFailureThreshold(),
                config.detailConcurrency(), null);
        notifyRegistry();
        startListPhase();
    }

    @Override
    public void postStop() throws Exception {
        log.info("[{}] Session actor stopped in state {}", sessionId, status);
        super.postStop();
    }

    // --- Supervision Strategy ---
    private static final SupervisorStrategy strategy = new OneForOneStrategy(
            10, Duration.ofMinutes(1),
            DeciderBuilder
                    .match(Exception.class, e -> {
                        log.error("Session child failed. Stopping it.", e);
                        return SupervisorStrategy.stop();
                    })
                    .matchAny(o -> {
                        log.error("Session child failed with unhandled Throwable type [{}]. Escalating.", o.getClass().getName(), o);
                        return SupervisorStrategy.escalate();
                    })
                    .build());
    @Override public SupervisorStrategy supervisorStrategy() { return strategy; }

    // --- Receive Method ---
    @Override
    public Receive createReceive() {
        return receiveBuilder()
                .match(GetStatus.class, msg -> getSender().tell(statusView(), getSelf()))
                .match(PauseSession.class, msg -> handlePause())
                .match(ResumeSession.class, msg -> handleResume())
                .match(RequestShutdown.class, msg -> handleShutdown())
                .match(PhaseProgress.class, this::handlePhaseProgress)
                .match(BatchFinished.class, this::handleBatchFinished)
                .match(PhaseFinished.class, msg -> handlePhaseFinished(msg.result()))
                .match(Terminated.class, this::handleTerminated)
                .match(ResumeTokenWriteFailed.class, this::handleTokenWriteFailed)
                .match(RemoveAfterGrace.class, msg -> handleRemoveAfterGrace())
                .matchAny(this::handleUnknownMessage)
                .build();
    }

    // --- Command Handlers ---

    private void handlePause() {
        if (status != SessionStatus.RUNNING) {
            reject("cannot pause a session that is " + status.label());
            return;
        }
        status = SessionStatus.PAUSED;
        tellCoordinator(new PausePhase());
        log.info("[{}] Session paused; in-flight tasks will still report", sessionId);
        runtime.events().publish(new CrawlEvent.SessionPaused(sessionId));
        accept();
        notifyRegistry();
    }

    private void handleResume() {
        if (status != SessionStatus.PAUSED) {
            reject("cannot resume a session that is " + status.label());
            return;
        }
        status = SessionStatus.RUNNING;
        tellCoordinator(new ResumePhase());
        log.info("[{}] Session resumed", sessionId);
        runtime.events().publish(new CrawlEvent.SessionResumed(sessionId));
        accept();
        notifyRegistry();
    }

    private void handleShutdown() {
        if (status == SessionStatus.SHUTTING_DOWN) {
            reject("shutdown already requested");
            return;
        }
        runtime.events().publish(new CrawlEvent.ShutdownRequested(sessionId));
        if (status.isActive()) {
            status = SessionStatus.SHUTTING_DOWN;
            shutdownRequested = true;
            log.info("[{}] Shutdown requested; draining {} for up to {}", sessionId, activePhase, config.shutdownTimeout());
            accept();
            notifyRegistry();
            if (coordinator != null) {
                coordinator.tell(new DrainPhase(config.shutdownTimeout()), getSelf());
            } else {
                finishShutdown(0);
            }
            return;
        }
        // Completed or Failed: nothing left to drain.
        status = SessionStatus.SHUTTING_DOWN;
        log.info("[{}] Shutdown requested after session ended", sessionId);
        runtime.events().publish(new CrawlEvent.ShutdownCompleted(sessionId, 0));
        accept();
        notifyRegistry();
    }

    // --- Coordinator Handlers ---

    private void handlePhaseProgress(PhaseProgress msg) {
        if (!isFromActiveCoordinator()) {
            return;
        }
        // Progress carries counters only; keep the task lists of the last full snapshot.
        PhaseSnapshot snapshot = msg.snapshot();
        if (snapshot.phase() == PhaseKind.LIST_COLLECTION) {
            pages = snapshot.withTaskListsFrom(pages);
            for (ProductRef ref : msg.discovered()) {
                discovered.putIfAbsent(ref.id(), ref);
            }
        } else {
            details = snapshot.withTaskListsFrom(details);
        }
    }

    private void handleBatchFinished(BatchFinished msg) {
        if (!isFromActiveCoordinator()) {
            return;
        }
        if (msg.phase() == PhaseKind.LIST_COLLECTION) {
            pages = msg.snapshot();
        } else {
            details = msg.snapshot();
        }
        if (config.checkpointOnBatch()) {
            log.debug("[{}] {} batch {} finished; writing checkpoint", sessionId, msg.phase(), msg.batchIndex());
            emitToken(true);
        }
    }

    private void handlePhaseFinished(PhaseResult result) {
        if (!isFromActiveCoordinator()) {
            log.warn("[{}] Ignoring PhaseFinished from inactive coordinator {}", sessionId, getSender());
            return;
        }
        stopCoordinator();
        if (result.phase() == PhaseKind.LIST_COLLECTION) {
            pages = result.snapshot();
        } else {
            details = result.snapshot();
        }
        log.info("[{}] {} finished with {} ({} succeeded, {} failed)", sessionId, result.phase(), result.outcome(),
                result.snapshot().succeeded(), result.snapshot().failed());

        if (shutdownRequested) {
            finishShutdown(result.snapshot().unfinishedTasks().size());
            return;
        }
        switch (result.outcome()) {
            case COMPLETED -> {
                if (result.phase() == PhaseKind.LIST_COLLECTION && !discovered.isEmpty()) {
                    startDetailPhase();
                } else {
                    completeSession();
                }
            }
            case THRESHOLD_EXCEEDED -> failSession(result.phase() + " " + result.reason());
            default -> failSession(result.phase() + " ended with " + result.outcome() + ": " + result.reason());
        }
    }

    private void handleTerminated(Terminated msg) {
        if (!msg.actor().equals(coordinator)) {
            log.debug("[{}] Ignoring termination of {}", sessionId, msg.actor());
            return;
        }
        log.error("[{}] {} coordinator terminated unexpectedly", sessionId, activePhase);
        coordinator = null;
        if (shutdownRequested) {
            finishShutdown(0);
        } else {
            failSession("INTERNAL_ERROR: " + activePhase + " coordinator terminated unexpectedly");
        }
    }

    private void handleTokenWriteFailed(ResumeTokenWriteFailed msg) {
        log.error("[{}] {} resume token was not stored ({}); it remains available in the session status",
                sessionId, msg.checkpoint() ? "Checkpoint" : "Final", msg.reason());
    }

    private void handleRemoveAfterGrace() {
        log.info("[{}] Removal grace elapsed; stopping session", sessionId);
        getContext().stop(getSelf());
    }

    private void handleUnknownMessage(Object msg) {
        log.warn("[{}] Received unknown message: {} from {}", sessionId, msg.getClass().getName(), getSender());
    }

    // --- Phase Management ---

    private void startListPhase() {
        Map<String, Integer> seeded = new HashMap<>();
        if (restorePlan != null) {
            restorePlan.retriesPerPage().forEach((page, retries) -> seeded.put(PageTask.keyFor(page), retries));
        }
        startPhase(config.listPhase(), pageTasks(), seeded);
    }

    private void startDetailPhase() {
        List<DetailTask> tasks = new ArrayList<>();
        for (ProductRef ref : discovered.values()) {
            tasks.add(DetailTask.of(ref));
        }
        Map<String, Integer> seeded = new HashMap<>();
        if (restorePlan != null) {
            restorePlan.detailRetryCounts().forEach((id, retries) -> seeded.put(DetailTask.keyFor(id), retries));
        }
        detailPhaseStarted = true;
        details = PhaseSnapshot.initial(PhaseKind.DETAIL_COLLECTION, tasks, config.detailFailureThreshold(),
                config.detailConcurrency(), runtime.clock().instant());
        log.info("[{}] Starting detail phase for {} distinct products", sessionId, tasks.size());
        startPhase(config.detailPhase(), tasks, seeded);
    }

    private void startPhase(PhaseSettings settings, List<? extends CrawlTask> tasks, Map<String, Integer> seeded) {
        activePhase = settings.phase();
        coordinator = getContext().actorOf(
                PhaseCoordinatorActor.props(sessionId, settings, tasks, seeded, runtime.taskExecutor(),
                        runtime.dispatcherId(), runtime.events(), runtime.clock()),
                settings.phase().taskPrefix() + "-coordinator");
        getContext().watch(coordinator);
        coordinator.tell(new StartPhase(status == SessionStatus.PAUSED), getSelf());
    }

    private void stopCoordinator() {
        if (coordinator != null) {
            getContext().unwatch(coordinator);
            getContext().stop(coordinator);
            coordinator = null;
        }
    }

    // --- Terminal Transitions ---

    private void completeSession() {
        status = SessionStatus.COMPLETED;
        completedAt = runtime.clock().instant();
        emitToken(false);
        long elapsedMs = Duration.between(startedAt, completedAt).toMillis();
        log.info("[{}] Session COMPLETED in {} ms: pages {}/{} ({} failed), details {}/{} ({} failed)",
                sessionId, elapsedMs, pages.succeeded(), pages.total(), pages.failed(),
                details.succeeded(), details.total(), details.failed());
        runtime.events().publish(new CrawlEvent.SessionCompleted(sessionId, pages.processed(), details.processed(), elapsedMs));
        notifyRegistry();
        scheduleRemoval();
    }

    private void failSession(String reason) {
        stopCoordinator();
        status = SessionStatus.FAILED;
        completedAt = runtime.clock().instant();
        emitToken(false);
        log.error("[{}] Session FAILED: {}", sessionId, reason);
        runtime.events().publish(new CrawlEvent.SessionFailed(sessionId, reason));
        notifyRegistry();
        scheduleRemoval();
    }

    private void finishShutdown(int remainingTasks) {
        completedAt = runtime.clock().instant();
        emitToken(false);
        log.info("[{}] Shutdown completed; {} tasks of the active phase left for a later session", sessionId, remainingTasks);
        runtime.events().publish(new CrawlEvent.ShutdownCompleted(sessionId, remainingTasks));
        notifyRegistry();
        scheduleRemoval();
    }

    private void scheduleRemoval() {
        getContext().getSystem().scheduler().scheduleOnce(
                config.removalGrace(), getSelf(), new RemoveAfterGrace(),
                getContext().getDispatcher(), ActorRef.noSender());
    }

    // --- Helper Methods ---

    private void emitToken(boolean checkpoint) {
        List<String> pending = detailPhaseStarted ? List.of() : new ArrayList<>(discovered.keySet());
        ResumeTokenManager.TokenSource source = new ResumeTokenManager.TokenSource(planHash, config.batchSize(),
                processedOffset, totalPages, pages, detailPhaseStarted ? details : null, pending);
        Optional<ResumeToken> token = runtime.tokens().emit(source);
        if (token.isEmpty()) {
            return;
        }
        String json = runtime.tokens().encode(token.get());
        latestToken = json;
        latestTokenPages = token.get().remainingPages();
        tokenWriter.tell(new WriteResumeToken(sessionId, planHash, json, checkpoint), getSelf());
        log.info("[{}] Emitted {} resume token: {} pages remaining", sessionId,
                checkpoint ? "checkpoint" : "final", latestTokenPages.size());
        runtime.events().publish(new CrawlEvent.ResumeTokenEmitted(sessionId, checkpoint, latestTokenPages.size(), planHash));
    }

    private SessionStatusView statusView() {
        return runtime.statusAggregator().aggregate(new StatusAggregator.StatusSource(
                sessionId, status, startedAt, completedAt, pages, details, processedOffset,
                latestToken, latestTokenPages, config.etaMinSample()));
    }

    private List<PageTask> pageTasks() {
        List<PageTask> tasks = new ArrayList<>();
        for (Integer page : config.pages()) {
            tasks.add(new PageTask(page));
        }
        return tasks;
    }

    private boolean isFromActiveCoordinator() {
        return coordinator != null && coordinator.equals(getSender());
    }

    private void tellCoordinator(Object msg) {
        if (coordinator != null) {
            coordinator.tell(msg, getSelf());
        }
    }

    private void accept() {
        getSender().tell(new CommandAccepted(sessionId, status), getSelf());
    }

    private void reject(String reason) {
        log.info("[{}] Rejected command: {}", sessionId, reason);
        getSender().tell(new CommandRejected(sessionId, status, reason), getSelf());
    }

    private void notifyRegistry() {
        getContext().getParent().tell(
                new SessionStatusChanged(new SessionSummary(sessionId, status, startedAt, completedAt)), getSelf());
    }
}
