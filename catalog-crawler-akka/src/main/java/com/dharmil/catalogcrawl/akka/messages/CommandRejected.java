package com.dharmil.catalogcrawl.akka.messages;

import com.dharmil.catalogcrawl.model.SessionStatus;

/**
 * A command that is not valid in the session's current state. The session is left untouched.
 *
 * @param status current status, {@code null} when no session was involved
 */
public record CommandRejected(String sessionId, SessionStatus status, String reason) implements CommandReply {

    @Override
    public boolean accepted() {
        return false;
    }
}
