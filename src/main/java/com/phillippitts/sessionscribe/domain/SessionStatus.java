package com.phillippitts.sessionscribe.domain;

/**
 * Lifecycle state of a recording session. {@code STOPPED} and {@code ERROR} are terminal.
 */
public enum SessionStatus {
    ACTIVE,
    STOPPED,
    ERROR;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
