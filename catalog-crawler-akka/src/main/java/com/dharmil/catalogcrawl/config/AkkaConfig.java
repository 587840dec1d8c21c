package com.dharmil.catalogcrawl.config;

import akka.actor.ActorRef;
import akka.actor.ActorSystem;
import com.dharmil.catalogcrawl.akka.actor.SessionRegistryActor;
import com.dharmil.catalogcrawl.akka.di.SpringAkkaExtension;
import com.dharmil.catalogcrawl.service.CrawlRuntime;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AkkaConfig {

    private static final Logger log = LoggerFactory.getLogger(AkkaConfig.class);

    public static final String ACTOR_SYSTEM_NAME = "CatalogCrawlSystem";

    @Autowired
    private ApplicationContext applicationContext;

    @Autowired
    private CrawlerProperties properties;

    @Bean(destroyMethod = "terminate")
    public ActorSystem actorSystem() {
        log.info("Initializing Akka ActorSystem...");

        final Config resolvedConfig = ConfigFactory.parseResources("application.conf")
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
        final String dispatcherPath = properties.getDispatcher();

        // The task dispatcher must exist before any phase coordinator looks it up.
        try {
            Config dispatcherConfig = resolvedConfig.getConfig(dispatcherPath);
            log.info("Found dispatcher config '{}' (type {}, executor {})", dispatcherPath,
                    dispatcherConfig.getString("type"), dispatcherConfig.getString("executor"));
        } catch (ConfigException.Missing e) {
            log.error("Dispatcher path '{}' is missing from the resolved configuration. Check application.conf.", dispatcherPath);
            if (log.isDebugEnabled()) {
                ConfigRenderOptions renderOpts = ConfigRenderOptions.defaults().setOriginComments(false).setComments(false).setJson(false);
                log.debug("Resolved configuration:\n---\n{}\n---", resolvedConfig.root().render(renderOpts));
            }
            throw new IllegalStateException("Missing required dispatcher configuration: " + dispatcherPath, e);
        }

        final ActorSystem system = ActorSystem.create(ACTOR_SYSTEM_NAME, resolvedConfig);
        log.info("Akka ActorSystem '{}' created.", system.name());

        try {
            system.dispatchers().lookup(dispatcherPath);
            log.info("Dispatcher '{}' lookup successful.", dispatcherPath);
        } catch (akka.ConfigurationException ce) {
            log.error("Dispatcher '{}' lookup failed: {}", dispatcherPath, ce.getMessage());
            system.terminate();
            throw new IllegalStateException("Dispatcher lookup failed during system initialization", ce);
        }

        try {
            SpringAkkaExtension.provider.get(system).initialize(applicationContext);
        } catch (RuntimeException e) {
            log.error("Failed to initialize SpringAkkaExtension!", e);
            system.terminate();
            throw new IllegalStateException("Could not initialize SpringAkkaExtension", e);
        }

        return system;
    }

    /**
     * Takes the runtime as a parameter so it is a finished singleton before the registry actor
     * asks the context for it.
     */
    @Bean
    @Qualifier("sessionRegistry")
    public ActorRef sessionRegistry(ActorSystem actorSystem, CrawlRuntime runtime) {
        ActorRef registry = actorSystem.actorOf(SessionRegistryActor.props(actorSystem), "session-registry");
        log.info("Created SessionRegistryActor: {} (tasks on {})", registry, runtime.dispatcherId());
        return registry;
    }
}
