package com.dharmil.catalogcrawl.akka.di;

import akka.actor.AbstractExtensionId;
import akka.actor.ExtendedActorSystem;
import akka.actor.Extension;
import akka.actor.Props;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;

/**
 * Akka extension holding the Spring {@link ApplicationContext}, used to build {@link Props} for
 * Spring-managed actor beans.
 * <p>
 * Initialize once per actor system:
 * {@code SpringAkkaExtension.provider.get(system).initialize(applicationContext);}
 * then create actors with
 * {@code system.actorOf(SpringAkkaExtension.provider.get(system).props("beanName"), "name");}
 */
public class SpringAkkaExtension extends AbstractExtensionId<SpringAkkaExtension.SpringExt> {

    private static final Logger log = LoggerFactory.getLogger(SpringAkkaExtension.class);

    public static final SpringAkkaExtension provider = new SpringAkkaExtension();

    private SpringAkkaExtension() {}

    @Override
    public SpringExt createExtension(ExtendedActorSystem system) {
        return new SpringExt();
    }

    public static class SpringExt implements Extension {

        private volatile ApplicationContext applicationContext;

        public void initialize(ApplicationContext applicationContext) {
            if (this.applicationContext != null) {
                log.warn("SpringAkkaExtension already initialized. Ignoring subsequent call.");
                return;
            }
            if (applicationContext == null) {
                throw new IllegalArgumentException("ApplicationContext cannot be null during SpringAkkaExtension initialization.");
            }
            this.applicationContext = applicationContext;
            log.info("SpringAkkaExtension initialized with ApplicationContext {}", applicationContext.getId());
        }

        /**
         * The bean named {@code actorBeanName} must have prototype scope.
         *
         * @throws IllegalStateException if {@link #initialize} has not been called
         */
        public Props props(String actorBeanName, Object... args) {
            if (applicationContext == null) {
                throw new IllegalStateException("SpringAkkaExtension has not been initialized. Call initialize(applicationContext) first.");
            }
            return Props.create(SpringActorProducer.class, applicationContext, actorBeanName, args);
        }
    }
}
