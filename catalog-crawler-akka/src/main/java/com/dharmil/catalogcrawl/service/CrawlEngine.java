package com.dharmil.catalogcrawl.service;

import akka.actor.ActorRef;
import akka.pattern.Patterns;
import com.dharmil.catalogcrawl.akka.messages.CommandRejected;
import com.dharmil.catalogcrawl.akka.messages.CommandReply;
import com.dharmil.catalogcrawl.akka.messages.GetStatus;
import com.dharmil.catalogcrawl.akka.messages.ListSessions;
import com.dharmil.catalogcrawl.akka.messages.PauseSession;
import com.dharmil.catalogcrawl.akka.messages.RequestShutdown;
import com.dharmil.catalogcrawl.akka.messages.ResumeSession;
import com.dharmil.catalogcrawl.akka.messages.SessionList;
import com.dharmil.catalogcrawl.akka.messages.SessionNotFound;
import com.dharmil.catalogcrawl.akka.messages.SessionStartedReply;
import com.dharmil.catalogcrawl.akka.messages.StartSession;
import com.dharmil.catalogcrawl.config.CrawlerProperties;
import com.dharmil.catalogcrawl.config.SessionConfigFactory;
import com.dharmil.catalogcrawl.model.RestorePlan;
import com.dharmil.catalogcrawl.model.SessionConfig;
import com.dharmil.catalogcrawl.model.SessionStatusView;
import com.dharmil.catalogcrawl.model.SessionSummary;
import com.dharmil.catalogcrawl.resume.InvalidResumeTokenException;
import com.dharmil.catalogcrawl.resume.ResumeTokenManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Command surface of the crawler. Every call is an ask against the session registry; replies
 * arrive asynchronously.
 * <p>
 * Unknown sessions complete the stage exceptionally with {@link SessionNotFoundException}, bad
 * resume tokens with {@link InvalidResumeTokenException}. A command that is invalid in the
 * session's current state is not an error: it comes back as a rejected {@link CommandReply}.
 */
@Service
public class CrawlEngine {

    private static final Logger log = LoggerFactory.getLogger(CrawlEngine.class);

    private final ActorRef sessionRegistry;
    private final SessionConfigFactory configFactory;
    private final ResumeTokenManager tokens;
    private final Duration askTimeout;

    public CrawlEngine(@Qualifier("sessionRegistry") ActorRef sessionRegistry,
                       SessionConfigFactory configFactory,
                       ResumeTokenManager tokens,
                       CrawlerProperties properties) {
        this.sessionRegistry = sessionRegistry;
        this.configFactory = configFactory;
        this.tokens = tokens;
        this.askTimeout = properties.getAskTimeout();
    }

    // --- Start ---

    public CompletionStage<String> start(SessionConfig config) {
        log.info("Starting crawl of {} pages (session id {})", config.pages().size(),
                config.sessionId() != null ? config.sessionId() : "<generated>");
        return startSession(new StartSession(config, null));
    }

    public CompletionStage<String> startPages(int firstPage, int lastPage) {
        return start(configFactory.forPageRange(firstPage, lastPage));
    }

    /** Restores a crawl from a resume token using the configured defaults. */
    public CompletionStage<String> startFromToken(String tokenJson) {
        return startFromToken(tokenJson, configFactory.defaults().build());
    }

    /**
     * Restores a crawl from a resume token. Pages, batch size and list concurrency come from the
     * token; every other setting comes from {@code template}.
     */
    public CompletionStage<String> startFromToken(String tokenJson, SessionConfig template) {
        RestorePlan plan;
        try {
            plan = tokens.load(tokenJson);
        } catch (InvalidResumeTokenException e) {
            log.warn("Rejected resume token: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        SessionConfig config = template.toBuilder()
                .pages(plan.remainingPages())
                .batchSize(plan.batchSize())
                .listConcurrency(plan.concurrencyLimit())
                .build();
        log.info("Restoring crawl of plan {}: {} pages, {} details", plan.planHash(),
                plan.remainingPages().size(), plan.remainingDetailIds().size());
        return startSession(new StartSession(config, plan));
    }

    private CompletionStage<String> startSession(StartSession msg) {
        return Patterns.ask(sessionRegistry, msg, askTimeout).thenCompose(reply -> {
            if (reply instanceof SessionStartedReply started) {
                return CompletableFuture.completedFuture(started.sessionId());
            }
            if (reply instanceof CommandRejected rejected) {
                return CompletableFuture.failedFuture(new IllegalStateException(rejected.reason()));
            }
            return CompletableFuture.failedFuture(unexpected(reply));
        });
    }

    // --- Control ---

    public CompletionStage<CommandReply> pause(String sessionId) {
        return command(new PauseSession(sessionId));
    }

    public CompletionStage<CommandReply> resume(String sessionId) {
        return command(new ResumeSession(sessionId));
    }

    public CompletionStage<CommandReply> requestShutdown(String sessionId) {
        return command(new RequestShutdown(sessionId));
    }

    private CompletionStage<CommandReply> command(Object msg) {
        return Patterns.ask(sessionRegistry, msg, askTimeout).thenCompose(reply -> {
            if (reply instanceof CommandReply commandReply) {
                if (commandReply instanceof CommandRejected rejected) {
                    log.info("Command {} rejected for session {}: {}", msg.getClass().getSimpleName(),
                            rejected.sessionId(), rejected.reason());
                }
                return CompletableFuture.completedFuture(commandReply);
            }
            return failed(reply);
        });
    }

    // --- Queries ---

    public CompletionStage<SessionStatusView> getStatus(String sessionId) {
        return Patterns.ask(sessionRegistry, new GetStatus(sessionId), askTimeout).thenCompose(reply -> {
            if (reply instanceof SessionStatusView view) {
                return CompletableFuture.completedFuture(view);
            }
            return failed(reply);
        });
    }

    public CompletionStage<List<SessionSummary>> listSessions() {
        return Patterns.ask(sessionRegistry, new ListSessions(), askTimeout).thenCompose(reply -> {
            if (reply instanceof SessionList list) {
                return CompletableFuture.completedFuture(list.sessions());
            }
            return failed(reply);
        });
    }

    private static <T> CompletionStage<T> failed(Object reply) {
        if (reply instanceof SessionNotFound notFound) {
            return CompletableFuture.failedFuture(new SessionNotFoundException(notFound.sessionId()));
        }
        return CompletableFuture.failedFuture(unexpected(reply));
    }

    private static IllegalStateException unexpected(Object reply) {
        return new IllegalStateException("Unexpected reply from session registry: " + reply.getClass().getName());
    }
}
