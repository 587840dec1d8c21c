package com.dharmil.catalogcrawl.akka.actor;

import akka.actor.AbstractActor;
import akka.actor.Props;
import com.dharmil.catalogcrawl.akka.messages.ResumeTokenWriteFailed;
import com.dharmil.catalogcrawl.akka.messages.WriteResumeToken;
import com.dharmil.catalogcrawl.resume.ResumeTokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a session's resume tokens to the {@link ResumeTokenStore}, one at a time and in the
 * order they were emitted. Created on the blocking dispatcher so store I/O never runs on the
 * session's thread. Failed writes are reported to the sender as {@link ResumeTokenWriteFailed}.
 */
public class ResumeTokenWriterActor extends AbstractActor {

    private static final Logger log = LoggerFactory.getLogger(ResumeTokenWriterActor.class);

    private final ResumeTokenStore store;

    public static Props props(ResumeTokenStore store, String dispatcherId) {
        return Props.create(ResumeTokenWriterActor.class, () -> new ResumeTokenWriterActor(store))
                .withDispatcher(dispatcherId);
    }

    public ResumeTokenWriterActor(ResumeTokenStore store) {
        if (store == null) {
            throw new IllegalArgumentException("ResumeTokenStore is required");
        }
        this.store = store;
    }

    @Override
    public Receive createReceive() {
        return receiveBuilder()
                .match(WriteResumeToken.class, this::handleWrite)
                .matchAny(msg -> log.warn("Received unknown message: {} from {}", msg.getClass().getName(), getSender()))
                .build();
    }

    private void handleWrite(WriteResumeToken msg) {
        try {
            store.save(msg.sessionId(), msg.planHash(), msg.tokenJson(), msg.checkpoint());
            log.debug("[{}] Stored {} resume token", msg.sessionId(), msg.checkpoint() ? "checkpoint" : "final");
        } catch (RuntimeException e) {
            log.error("[{}] Could not store resume token", msg.sessionId(), e);
            getSender().tell(new ResumeTokenWriteFailed(msg.sessionId(), msg.checkpoint(), e.getMessage()), getSelf());
        }
    }
}
