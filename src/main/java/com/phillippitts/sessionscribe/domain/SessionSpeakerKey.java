package com.phillippitts.sessionscribe.domain;

import java.util.Objects;

/**
 * Composite identity of one speaker within one recording session.
 *
 * <p>Used as the key of every per-speaker registry so that lookups never depend on string
 * concatenation conventions.
 */
public record SessionSpeakerKey(String sessionId, String speakerId) {

    public SessionSpeakerKey {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(speakerId, "speakerId must not be null");
    }

    public static SessionSpeakerKey of(String sessionId, String speakerId) {
        return new SessionSpeakerKey(sessionId, speakerId);
    }
}
