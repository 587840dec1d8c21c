package com.dharmil.catalogcrawl.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Best-effort multicast of crawl events. Publishing never blocks: each subscriber owns a bounded
 * buffer and lagging subscribers lose events. Sequence numbers are assigned at publish time and
 * are strictly increasing, so gaps reveal drops.
 */
public class CrawlEventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(CrawlEventBroadcaster.class);

    private final int bufferSize;
    private final Clock clock;
    private final AtomicLong seq = new AtomicLong();
    private final CopyOnWriteArrayList<EventSubscription> subscribers = new CopyOnWriteArrayList<>();

    public CrawlEventBroadcaster(int bufferSize, Clock clock) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be >= 1 but was " + bufferSize);
        }
        this.bufferSize = bufferSize;
        this.clock = clock;
    }

    public EventEnvelope publish(CrawlEvent event) {
        EventEnvelope envelope = new EventEnvelope(seq.incrementAndGet(), clock.instant(), event);
        for (EventSubscription subscriber : subscribers) {
            subscriber.offer(envelope);
        }
        if (log.isTraceEnabled()) {
            log.trace("Published #{} {} for session {}", envelope.seq(), event.variant(), event.sessionId());
        }
        return envelope;
    }

    public EventSubscription subscribe() {
        EventSubscription subscription = new EventSubscription(bufferSize, subscribers::remove);
        subscribers.add(subscription);
        log.debug("New event subscriber; {} active", subscribers.size());
        return subscription;
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public long lastSequence() {
        return seq.get();
    }
}
