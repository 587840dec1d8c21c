package com.dharmil.catalogcrawl.akka.messages;

import com.dharmil.catalogcrawl.model.SessionStatus;

/**
 * @param status session status after the command was applied
 */
public record CommandAccepted(String sessionId, SessionStatus status) implements CommandReply {

    @Override
    public boolean accepted() {
        return true;
    }
}
