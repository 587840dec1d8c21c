package com.dharmil.catalogcrawl.events;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * A subscriber's bounded view of the event stream. When the consumer falls behind, new events are
 * dropped for this subscriber only and counted in {@link #droppedCount()}.
 */
public class EventSubscription implements AutoCloseable {

    private final BlockingQueue<EventEnvelope> buffer;
    private final AtomicLong dropped = new AtomicLong();
    private final Consumer<EventSubscription> onClose;
    private volatile boolean closed;

    EventSubscription(int capacity, Consumer<EventSubscription> onClose) {
        this.buffer = new ArrayBlockingQueue<>(capacity);
        this.onClose = onClose;
    }

    void offer(EventEnvelope envelope) {
        if (closed) {
            return;
        }
        if (!buffer.offer(envelope)) {
            dropped.incrementAndGet();
        }
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the next envelope, or {@code null} if none arrived in time
     */
    public EventEnvelope poll(Duration timeout) throws InterruptedException {
        return buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public List<EventEnvelope> drain() {
        List<EventEnvelope> drained = new ArrayList<>();
        buffer.drainTo(drained);
        return drained;
    }

    public long droppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            onClose.accept(this);
        }
    }
}
