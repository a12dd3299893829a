package com.phillippitts.sessionscribe.domain;

/**
 * A transcript event bound to its session, track and (when resolvable) burst, as handed to the store.
 *
 * <p>Upsert key: {@code (sessionId, trackId, event.speakerId, event.streamSequence, event.resultId)}
 * when {@code resultId} is present.
 */
public record TranscriptRecord(String sessionId, Long trackId, Long burstId, String displayName, TranscriptEvent event) {

    public boolean hasUpsertKey() {
        return event.resultId() != null;
    }
}
