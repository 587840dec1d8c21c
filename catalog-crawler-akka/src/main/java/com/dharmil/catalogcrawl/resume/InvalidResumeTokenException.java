package com.dharmil.catalogcrawl.resume;

/**
 * A resume token that cannot be decoded or cannot seed a session.
 */
public class InvalidResumeTokenException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InvalidResumeTokenException(String message) {
        super(message);
    }

    public InvalidResumeTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
