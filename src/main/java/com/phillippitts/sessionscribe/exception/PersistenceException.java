package com.phillippitts.sessionscribe.exception;

/**
 * Thrown when the recording store cannot be read or appended to.
 * Treated as fatal for the operation that triggered it.
 */
public class PersistenceException extends SessionScribeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
