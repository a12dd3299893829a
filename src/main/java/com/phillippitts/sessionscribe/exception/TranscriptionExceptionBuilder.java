package com.phillippitts.sessionscribe.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link TranscriptionException} carrying stream context.
 *
 * <pre>
 * throw TranscriptionExceptionBuilder.create("Failed to open recognizer")
 *         .engine("vosk")
 *         .speaker(speakerId)
 *         .sequence(3)
 *         .cause(e)
 *         .metadata("modelPath", modelPath)
 *         .build();
 * </pre>
 */
public final class TranscriptionExceptionBuilder {

    private final String message;
    private String engineName;
    private String speakerId;
    private Integer sequence;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    public TranscriptionExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    public TranscriptionExceptionBuilder speaker(String speakerId) {
        this.speakerId = speakerId;
        return this;
    }

    public TranscriptionExceptionBuilder sequence(int sequence) {
        this.sequence = sequence;
        return this;
    }

    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a key/value pair appended to the message. Null keys or values are ignored.
     */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Message format: {@code {message} (speaker={id}, sequence={n}, key=value, ...)}.
     */
    public TranscriptionException build() {
        String engine = engineName != null ? engineName : "unknown";
        String detailed = detailedMessage();
        return cause != null
                ? new TranscriptionException(detailed, engine, cause)
                : new TranscriptionException(detailed, engine);
    }

    private String detailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (speakerId != null) {
            details.put("speaker", speakerId);
        }
        if (sequence != null) {
            details.put("sequence", String.valueOf(sequence));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
