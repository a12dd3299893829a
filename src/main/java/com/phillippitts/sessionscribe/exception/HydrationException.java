package com.phillippitts.sessionscribe.exception;

/**
 * Thrown by the offline hydration tool when it cannot proceed. Carries the process exit code
 * the command line front end should return.
 */
public class HydrationException extends SessionScribeException {

    private final int exitCode;

    public HydrationException(String message) {
        this(message, 1, null);
    }

    public HydrationException(String message, Throwable cause) {
        this(message, 1, cause);
    }

    public HydrationException(String message, int exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
