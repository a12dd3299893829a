package com.phillippitts.sessionscribe.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One continuous recording of one speaker within one session.
 *
 * <p>A speaker who leaves and rejoins gets a new track with the next {@code trackNumber}.
 * {@code firstPacketAt} is the wall clock of the first real audio frame, which can be much later
 * than {@code createdAt} (subscription time); hydration anchors on it.
 *
 * @param id            store-assigned identifier
 * @param sessionId     owning session
 * @param speakerId     speaker recorded on this track
 * @param trackNumber   1-based rejoin counter for the speaker within the session
 * @param filePath      container file path
 * @param createdAt     subscription time
 * @param firstPacketAt first frame time, {@code null} until audio arrives
 * @param endedAt       close time, {@code null} while open
 */
public record Track(
        long id,
        String sessionId,
        String speakerId,
        int trackNumber,
        String filePath,
        Instant createdAt,
        Instant firstPacketAt,
        Instant endedAt
) {
    public Track {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(speakerId, "speakerId must not be null");
        Objects.requireNonNull(filePath, "filePath must not be null");
        if (trackNumber < 1) {
            throw new IllegalArgumentException("trackNumber must be >= 1, got: " + trackNumber);
        }
    }

    public boolean isOpen() {
        return endedAt == null;
    }

    public Track withFirstPacketAt(Instant at) {
        return new Track(id, sessionId, speakerId, trackNumber, filePath, createdAt, at, endedAt);
    }

    public Track withEndedAt(Instant at) {
        return new Track(id, sessionId, speakerId, trackNumber, filePath, createdAt, firstPacketAt, at);
    }
}
