package com.phillippitts.sessionscribe.domain;

import java.time.Instant;

/**
 * A speaker's presence in a session. {@code leftAt} is {@code null} while present.
 */
public record Participant(String sessionId, String speakerId, String displayName, Instant joinedAt, Instant leftAt) {

    public Participant withLeftAt(Instant at) {
        return new Participant(sessionId, speakerId, displayName, joinedAt, at);
    }
}
