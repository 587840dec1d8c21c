package com.dharmil.catalogcrawl.akka.di;

import akka.actor.Actor;
import akka.actor.IndirectActorProducer;
import org.springframework.context.ApplicationContext;

/**
 * Lets Akka obtain actor instances from the Spring context, so actors declared as prototype
 * beans get their collaborators injected. A fresh bean is fetched on every (re)start.
 */
public class SpringActorProducer implements IndirectActorProducer {

    private final ApplicationContext applicationContext;
    private final String actorBeanName;
    private final Object[] args;

    /**
     * @param args explicit constructor arguments for beans that need values Spring cannot supply
     */
    public SpringActorProducer(ApplicationContext applicationContext, String actorBeanName, Object... args) {
        this.applicationContext = applicationContext;
        this.actorBeanName = actorBeanName;
        this.args = args;
    }

    @Override
    public Actor produce() {
        if (args == null || args.length == 0) {
            return (Actor) applicationContext.getBean(actorBeanName);
        }
        return (Actor) applicationContext.getBean(actorBeanName, args);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Class<? extends Actor> actorClass() {
        return (Class<? extends Actor>) applicationContext.getType(actorBeanName);
    }
}
