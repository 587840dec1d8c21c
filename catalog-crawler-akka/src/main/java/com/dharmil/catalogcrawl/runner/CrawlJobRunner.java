package com.dharmil.catalogcrawl.runner;

import akka.actor.ActorSystem;
import akka.actor.Cancellable;
import com.dharmil.catalogcrawl.config.CrawlerProperties;
import com.dharmil.catalogcrawl.config.SessionConfigFactory;
import com.dharmil.catalogcrawl.model.SessionConfig;
import com.dharmil.catalogcrawl.model.SessionStatusView;
import com.dharmil.catalogcrawl.service.CrawlEngine;
import com.dharmil.catalogcrawl.service.SessionNotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Launches a crawl on application startup when {@code crawler.autostart.enabled} is set, either
 * over a page range or from a resume token file, and logs the session status until it ends.
 */
@Component
@Profile("!test")
public class CrawlJobRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(CrawlJobRunner.class);

    private final CrawlEngine engine;
    private final SessionConfigFactory configFactory;
    private final CrawlerProperties properties;
    private final ActorSystem actorSystem;
    private final ObjectMapper objectMapper;

    public CrawlJobRunner(CrawlEngine engine, SessionConfigFactory configFactory, CrawlerProperties properties,
                          ActorSystem actorSystem, ObjectMapper objectMapper) {
        this.engine = engine;
        this.configFactory = configFactory;
        this.properties = properties;
        this.actorSystem = actorSystem;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(String... args) throws Exception {
        CrawlerProperties.Autostart autostart = properties.getAutostart();
        if (!autostart.isEnabled()) {
            log.info("CommandLineRunner: crawl autostart is disabled (crawler.autostart.enabled=false).");
            return;
        }

        SessionConfig template = configFactory.defaults().sessionId(autostart.getSessionId()).build();
        CompletionStage<String> started;
        if (autostart.getResumeTokenFile() != null && !autostart.getResumeTokenFile().isBlank()) {
            Path tokenFile = Path.of(autostart.getResumeTokenFile());
            log.info("========== Resuming crawl from token file {} ==========", tokenFile);
            started = engine.startFromToken(Files.readString(tokenFile), template);
        } else {
            log.info("========== Launching crawl of pages {}..{} ==========",
                    autostart.getFirstPage(), autostart.getLastPage());
            started = engine.start(template.toBuilder()
                    .pages(SessionConfig.pageRange(autostart.getFirstPage(), autostart.getLastPage()))
                    .build());
        }

        started.whenComplete((sessionId, error) -> {
            if (error != null) {
                log.error("!!!!!!!!!! Crawl session could not be started !!!!!!!!!!", unwrap(error));
                return;
            }
            log.info("Crawl session {} started. Reporting status every {}", sessionId, autostart.getStatusInterval());
            watch(sessionId, autostart.getStatusInterval());
        });
        log.info("Crawl launch initiated. Waiting for completion (async)...");
    }

    private void watch(String sessionId, Duration interval) {
        AtomicReference<Cancellable> ticker = new AtomicReference<>();
        ticker.set(actorSystem.scheduler().scheduleWithFixedDelay(interval, interval,
                () -> engine.getStatus(sessionId).whenComplete((status, error) -> {
                    if (error != null) {
                        if (unwrap(error) instanceof SessionNotFoundException) {
                            log.info("Crawl session {} is no longer registered; status reporting stopped", sessionId);
                        } else {
                            log.error("Status query for session {} failed", sessionId, unwrap(error));
                        }
                        ticker.get().cancel();
                        return;
                    }
                    report(status);
                    if (status.status().isTerminal()) {
                        ticker.get().cancel();
                    }
                }),
                actorSystem.dispatcher()));
    }

    private void report(SessionStatusView status) {
        if (!status.status().isTerminal()) {
            log.info("Session {} {}: pages {}/{} ({}%), details {}/{}", status.sessionId(), status.status(),
                    status.pages().processed(), status.pages().total(), status.pages().percent(),
                    status.details().processed(), status.details().total());
            return;
        }
        try {
            log.info("========== Crawl session {} finished: {} ==========\n{}", status.sessionId(), status.status(),
                    objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(status));
        } catch (JsonProcessingException e) {
            log.warn("Could not render final status of session {}: {}", status.sessionId(), e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
