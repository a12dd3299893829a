package com.phillippitts.sessionscribe.exception;

/**
 * Base exception for all SessionScribe errors.
 * Subclasses describe which stage of the recording pipeline failed.
 */
public class SessionScribeException extends RuntimeException {

    public SessionScribeException(String message) {
        super(message);
    }

    public SessionScribeException(String message, Throwable cause) {
        super(message, cause);
    }
}
