package com.dharmil.catalogcrawl.events;

import akka.actor.ActorSystem;
import akka.actor.Cancellable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Forwards the event stream to the log in the configured wire format. The subscription is drained
 * on the actor system's scheduler at a fixed delay, so runs never overlap.
 */
public class CrawlEventLogBridge implements InitializingBean, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(CrawlEventLogBridge.class);

    static final Duration DRAIN_INTERVAL = Duration.ofMillis(200);

    private final CrawlEventBroadcaster broadcaster;
    private final EventWireFormat wireFormat;
    private final ActorSystem actorSystem;
    private final AtomicLong forwarded = new AtomicLong();
    private final AtomicLong reportedDrops = new AtomicLong();
    private EventSubscription subscription;
    private Cancellable drainTask;

    public CrawlEventLogBridge(CrawlEventBroadcaster broadcaster, EventWireFormat wireFormat, ActorSystem actorSystem) {
        this.broadcaster = broadcaster;
        this.wireFormat = wireFormat;
        this.actorSystem = actorSystem;
    }

    @Override
    public void afterPropertiesSet() {
        subscription = broadcaster.subscribe();
        drainTask = actorSystem.scheduler().scheduleWithFixedDelay(
                DRAIN_INTERVAL, DRAIN_INTERVAL, this::drainOnce, actorSystem.dispatcher());
        log.info("Event log bridge started (mode {}, every {} ms)", wireFormat.mode(), DRAIN_INTERVAL.toMillis());
    }

    synchronized void drainOnce() {
        if (subscription == null || subscription.isClosed()) {
            return;
        }
        for (EventEnvelope envelope : subscription.drain()) {
            try {
                log.info("{}", wireFormat.toJson(envelope));
                forwarded.incrementAndGet();
            } catch (RuntimeException e) {
                log.error("Failed to forward event {} ({})", envelope.seq(), envelope.event().getClass().getSimpleName(), e);
            }
        }
        long drops = subscription.droppedCount();
        if (drops > reportedDrops.get()) {
            log.warn("Event log bridge lagged; {} events skipped so far", drops);
            reportedDrops.set(drops);
        }
    }

    public long forwardedCount() {
        return forwarded.get();
    }

    @Override
    public void destroy() {
        if (drainTask != null) {
            drainTask.cancel();
        }
        if (subscription != null) {
            subscription.close();
        }
        log.info("Event log bridge stopped after forwarding {} events", forwarded.get());
    }
}
