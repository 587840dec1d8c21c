package com.dharmil.catalogcrawl.akka.actor;

import akka.actor.AbstractActor;
import akka.actor.ActorRef;
import akka.actor.ActorSystem;
import akka.actor.OneForOneStrategy;
import akka.actor.Props;
import akka.actor.SupervisorStrategy;
import akka.actor.Terminated;
import akka.japi.pf.DeciderBuilder;
import com.dharmil.catalogcrawl.akka.di.SpringAkkaExtension;
import com.dharmil.catalogcrawl.akka.messages.CommandRejected;
import com.dharmil.catalogcrawl.akka.messages.ListSessions;
import com.dharmil.catalogcrawl.akka.messages.SessionCommand;
import com.dharmil.catalogcrawl.akka.messages.SessionList;
import com.dharmil.catalogcrawl.akka.messages.SessionNotFound;
import com.dharmil.catalogcrawl.akka.messages.SessionStartedReply;
import com.dharmil.catalogcrawl.akka.messages.SessionStatusChanged;
import com.dharmil.catalogcrawl.akka.messages.StartSession;
import com.dharmil.catalogcrawl.model.SessionConfig;
import com.dharmil.catalogcrawl.model.SessionStatus;
import com.dharmil.catalogcrawl.model.SessionSummary;
import com.dharmil.catalogcrawl.service.CrawlRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Single control boundary of the crawler. Creates sessions, routes per-session commands to the
 * owning {@link SessionActor} (replies go straight back to the asker) and keeps the summaries
 * returned by {@link ListSessions}. Sessions are forgotten once they stop after their removal grace.
 */
@Component(SessionRegistryActor.BEAN_NAME)
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
public class SessionRegistryActor extends AbstractActor {

    public static final String BEAN_NAME = "sessionRegistryActor";

    private static final Logger log = LoggerFactory.getLogger(SessionRegistryActor.class);

    // --- Dependencies ---
    private final CrawlRuntime runtime;

    // --- Registry State ---
    private final Map<String, ActorRef> sessions = new HashMap<>();
    private final Map<ActorRef, String> sessionIds = new HashMap<>();
    private final Map<String, SessionSummary> summaries = new LinkedHashMap<>();
    private long sessionCounter;

    public static Props props(ActorSystem system) {
        return SpringAkkaExtension.provider.get(system).props(BEAN_NAME);
    }

    public SessionRegistryActor(CrawlRuntime runtime) {
        this.runtime = runtime;
    }

    @Override
    public void preStart() throws Exception {
        super.preStart();
        log.info("SessionRegistryActor started. Task dispatcher: {}", runtime.dispatcherId());
        if (runtime.taskExecutor() == null) {
            throw new IllegalStateException("CrawlRuntime has no TaskExecutor");
        }
    }

    // --- Supervision Strategy ---
    private static final SupervisorStrategy strategy = new OneForOneStrategy(
            10, Duration.ofMinutes(1),
            DeciderBuilder
                    .match(Exception.class, e -> {
                        log.error("Session actor failed. Stopping it.", e);
                        return SupervisorStrategy.stop();
                    })
                    .matchAny(o -> {
                        log.error("Session actor failed with unhandled Throwable type [{}]. Escalating.", o.getClass().getName(), o);
                        return SupervisorStrategy.escalate();
                    })
                    .build());
    @Override public SupervisorStrategy supervisorStrategy() { return strategy; }

    // --- Receive Method ---
    @Override
    public Receive createReceive() {
        return receiveBuilder()
                .match(StartSession.class, this::handleStartSession)
                .match(SessionCommand.class, this::routeToSession)
                .match(ListSessions.class, msg -> getSender().tell(new SessionList(new ArrayList<>(summaries.values())), getSelf()))
                .match(SessionStatusChanged.class, this::handleStatusChanged)
                .match(Terminated.class, this::handleTerminated)
                .matchAny(msg -> log.warn("Received unknown message: {} from {}", msg.getClass().getName(), getSender()))
                .build();
    }

    // --- Message Handlers ---

    private void handleStartSession(StartSession msg) {
        SessionConfig config = msg.config();
        String sessionId = config.sessionId() != null ? config.sessionId() : UUID.randomUUID().toString();
        if (sessions.containsKey(sessionId)) {
            SessionSummary existing = summaries.get(sessionId);
            getSender().tell(new CommandRejected(sessionId, existing != null ? existing.status() : null,
                    "session " + sessionId + " already exists"), getSelf());
            return;
        }
        boolean hasPages = msg.restorePlan() != null
                ? !msg.restorePlan().remainingPages().isEmpty()
                : !config.pages().isEmpty();
        if (!hasPages) {
            getSender().tell(new CommandRejected(sessionId, null, "no pages to crawl"), getSelf());
            return;
        }
        ActorRef session = getContext().actorOf(
                SessionActor.props(config.withSessionId(sessionId), msg.restorePlan(), runtime),
                "session-" + (++sessionCounter));
        getContext().watch(session);
        sessions.put(sessionId, session);
        sessionIds.put(session, sessionId);
        summaries.put(sessionId, new SessionSummary(sessionId, SessionStatus.RUNNING, runtime.clock().instant(), null));
        log.info("Created session {} as {} ({} active)", sessionId, session.path().name(), sessions.size());
        getSender().tell(new SessionStartedReply(sessionId), getSelf());
    }

    private void routeToSession(SessionCommand msg) {
        ActorRef session = sessions.get(msg.sessionId());
        if (session == null) {
            log.debug("Command {} for unknown session {}", msg.getClass().getSimpleName(), msg.sessionId());
            getSender().tell(new SessionNotFound(msg.sessionId()), getSelf());
            return;
        }
        session.forward(msg, getContext());
    }

    private void handleStatusChanged(SessionStatusChanged msg) {
        SessionSummary summary = msg.summary();
        if (sessions.containsKey(summary.sessionId())) {
            summaries.put(summary.sessionId(), summary);
        }
    }

    private void handleTerminated(Terminated msg) {
        String sessionId = sessionIds.remove(msg.actor());
        if (sessionId == null) {
            log.warn("Received Terminated message for unknown actor: {}", msg.actor());
            return;
        }
        sessions.remove(sessionId);
        SessionSummary last = summaries.remove(sessionId);
        log.info("Session {} removed (last status {}); {} remain", sessionId,
                last != null ? last.status() : "unknown", sessions.size());
    }
}
