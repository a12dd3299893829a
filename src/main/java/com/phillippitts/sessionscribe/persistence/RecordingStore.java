package com.phillippitts.sessionscribe.persistence;

import com.phillippitts.sessionscribe.domain.Burst;
import com.phillippitts.sessionscribe.domain.Participant;
import com.phillippitts.sessionscribe.domain.RecordingSession;
import com.phillippitts.sessionscribe.domain.SessionStatus;
import com.phillippitts.sessionscribe.domain.Track;
import com.phillippitts.sessionscribe.domain.TranscriptRecord;
import com.phillippitts.sessionscribe.domain.UsageRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations used by the recording pipeline and the hydration tool.
 *
 * <p>Writes are append-only from the caller's point of view. All methods throw
 * {@link com.phillippitts.sessionscribe.exception.PersistenceException} when the store cannot be
 * written; callers treat that as fatal for the current operation.
 */
public interface RecordingStore {

    void insertSession(RecordingSession session);

    void endSession(String sessionId, Instant endedAt, SessionStatus status);

    Optional<RecordingSession> findSession(String sessionId);

    List<RecordingSession> findActiveSessions();

    /**
     * Moves every session still marked {@link SessionStatus#ACTIVE} to {@link SessionStatus#ERROR}.
     * Called once at startup, when no process can still be writing to them.
     *
     * @return number of sessions recovered
     */
    int recoverStaleSessions(Instant at);

    void insertParticipant(Participant participant);

    void markParticipantLeft(String sessionId, String speakerId, Instant leftAt);

    List<Participant> getParticipants(String sessionId);

    Track insertTrack(String sessionId, String speakerId, int trackNumber, String filePath, Instant createdAt);

    int countTracks(String sessionId, String speakerId);

    void markFirstPacket(long trackId, Instant at);

    void endTrack(long trackId, Instant endedAt);

    /** Tracks of a session ordered by creation time. */
    List<Track> getSessionTracks(String sessionId);

    Burst insertBurst(long trackId, Instant startedAt, long startFrameOffset);

    void closeBurst(long burstId, Instant endedAt, long endFrameOffset);

    /** Bursts of a track ordered by start time. */
    List<Burst> getTrackBursts(long trackId);

    /**
     * Finds the burst containing {@code at}, widening both ends by {@code tolerance}.
     * An open burst is treated as extending to infinity.
     */
    Optional<Burst> findBurstForTimestamp(long trackId, Instant at, Duration tolerance);

    /**
     * Idempotent upsert keyed by (session, track, speaker, stream sequence, result id). A final
     * record is never replaced by an interim one, and an existing burst id is kept when the new
     * record has none. Records without a result id are always inserted.
     */
    void upsertTranscript(TranscriptRecord record);

    List<TranscriptRecord> getTranscripts(String sessionId);

    void upsertUsage(UsageRecord usage);

    Optional<UsageRecord> getUsage(String sessionId, String engine);
}
