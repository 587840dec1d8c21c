package com.dharmil.catalogcrawl.config;

import akka.actor.ActorSystem;
import com.dharmil.catalogcrawl.collaborator.CatalogParser;
import com.dharmil.catalogcrawl.collaborator.LoggingProductPersister;
import com.dharmil.catalogcrawl.collaborator.PageFetcher;
import com.dharmil.catalogcrawl.collaborator.ProductPersister;
import com.dharmil.catalogcrawl.collaborator.SimulatedCatalog;
import com.dharmil.catalogcrawl.collaborator.SimulatedCatalogParser;
import com.dharmil.catalogcrawl.events.CrawlEventBroadcaster;
import com.dharmil.catalogcrawl.events.CrawlEventLogBridge;
import com.dharmil.catalogcrawl.events.EventWireFormat;
import com.dharmil.catalogcrawl.resume.JdbcResumeTokenStore;
import com.dharmil.catalogcrawl.resume.PlanHashVerifier;
import com.dharmil.catalogcrawl.resume.ResumeTokenCodec;
import com.dharmil.catalogcrawl.resume.ResumeTokenManager;
import com.dharmil.catalogcrawl.resume.ResumeTokenStore;
import com.dharmil.catalogcrawl.resume.TrustingPlanHashVerifier;
import com.dharmil.catalogcrawl.service.CrawlRuntime;
import com.dharmil.catalogcrawl.service.StatusAggregator;
import com.dharmil.catalogcrawl.service.TaskExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Crawl collaborators and shared services. The simulated fetcher, simulated parser and logging
 * persister are each registered only when the application provides no implementation of its own.
 */
@Configuration
@EnableConfigurationProperties(CrawlerProperties.class)
public class CrawlerConfig {

    private static final Logger log = LoggerFactory.getLogger(CrawlerConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // --- Collaborators ---

    @Bean
    @ConditionalOnMissingBean(PageFetcher.class)
    public SimulatedCatalog simulatedCatalog(CrawlerProperties properties) {
        CrawlerProperties.Simulation sim = properties.getSimulation();
        log.warn("No PageFetcher configured; crawling the simulated catalog at {}", sim.getBaseUrl());
        return new SimulatedCatalog(new SimulatedCatalog.Settings(sim.getBaseUrl(), sim.getProductsPerPage(),
                sim.getLatency().toMillis(), sim.getTimeoutRate(), sim.getRateLimitRate(),
                sim.getServerErrorRate(), sim.getParseErrorRate(), sim.getSeed()));
    }

    @Bean
    @ConditionalOnMissingBean(CatalogParser.class)
    public SimulatedCatalogParser simulatedCatalogParser() {
        log.warn("No CatalogParser configured; parsing bodies in the simulated catalog format");
        return new SimulatedCatalogParser();
    }

    @Bean
    @ConditionalOnMissingBean(ProductPersister.class)
    public LoggingProductPersister loggingProductPersister() {
        return new LoggingProductPersister();
    }

    @Bean
    public TaskExecutor taskExecutor(PageFetcher fetcher, CatalogParser parser, ProductPersister persister) {
        return new TaskExecutor(fetcher, parser, persister);
    }

    // --- Events ---

    @Bean
    public CrawlEventBroadcaster crawlEventBroadcaster(CrawlerProperties properties, Clock clock) {
        return new CrawlEventBroadcaster(properties.getEvents().getBufferSize(), clock);
    }

    @Bean
    public EventWireFormat eventWireFormat(ObjectMapper objectMapper, CrawlerProperties properties) {
        return new EventWireFormat(objectMapper, properties.getEvents().getMode());
    }

    @Bean
    @ConditionalOnProperty(prefix = "crawler.events", name = "log-bridge", havingValue = "true", matchIfMissing = true)
    public CrawlEventLogBridge crawlEventLogBridge(CrawlEventBroadcaster broadcaster, EventWireFormat wireFormat,
                                                  ActorSystem actorSystem) {
        return new CrawlEventLogBridge(broadcaster, wireFormat, actorSystem);
    }

    // --- Resume tokens ---

    @Bean
    public ResumeTokenCodec resumeTokenCodec(ObjectMapper objectMapper) {
        return new ResumeTokenCodec(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public PlanHashVerifier planHashVerifier() {
        return new TrustingPlanHashVerifier();
    }

    @Bean
    public ResumeTokenManager resumeTokenManager(ResumeTokenCodec codec, PlanHashVerifier verifier, Clock clock) {
        return new ResumeTokenManager(codec, verifier, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResumeTokenStore resumeTokenStore(JdbcTemplate jdbcTemplate, Clock clock) {
        return new JdbcResumeTokenStore(jdbcTemplate, clock);
    }

    // --- Runtime ---

    @Bean
    public StatusAggregator statusAggregator(Clock clock) {
        return new StatusAggregator(clock);
    }

    @Bean
    public SessionConfigFactory sessionConfigFactory(CrawlerProperties properties) {
        return new SessionConfigFactory(properties);
    }

    @Bean
    public CrawlRuntime crawlRuntime(TaskExecutor taskExecutor, CrawlerProperties properties,
                                     CrawlEventBroadcaster broadcaster, ResumeTokenManager tokens,
                                     ResumeTokenStore tokenStore, StatusAggregator statusAggregator, Clock clock) {
        log.info("Crawl runtime: tasks on dispatcher '{}', events in {} mode", properties.getDispatcher(),
                properties.getEvents().getMode());
        return new CrawlRuntime(taskExecutor, properties.getDispatcher(), broadcaster, tokens, tokenStore,
                statusAggregator, clock);
    }
}
