package com.phillippitts.sessionscribe.exception;

/**
 * Thrown when a speech-recognition engine cannot be created or a stream cannot be opened.
 */
public class TranscriptionException extends SessionScribeException {

    private final String engineName;

    public TranscriptionException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public TranscriptionException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
