package com.phillippitts.sessionscribe.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted view of a recording session.
 *
 * @param id        session identifier (UUID string)
 * @param guildId   community/server the voice channel belongs to
 * @param channelId voice channel being recorded
 * @param startedAt wall clock at session start
 * @param endedAt   wall clock at session end, {@code null} while active
 * @param status    lifecycle state
 */
public record RecordingSession(
        String id,
        String guildId,
        String channelId,
        Instant startedAt,
        Instant endedAt,
        SessionStatus status
) {
    public RecordingSession {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public RecordingSession withEnd(Instant at, SessionStatus newStatus) {
        return new RecordingSession(id, guildId, channelId, startedAt, at, newStatus);
    }
}
