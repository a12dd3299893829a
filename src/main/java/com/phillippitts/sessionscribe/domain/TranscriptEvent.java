package com.phillippitts.sessionscribe.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A transcript result emitted by an STT stream.
 *
 * <p>Interim events may be superseded by a final event with the same
 * {@code (speakerId, streamSequence, resultId)}; a final event is never replaced by an interim one.
 *
 * @param speakerId      speaker the stream belongs to
 * @param displayName    name supplied by the engine, usually {@code null}
 * @param speakerLabel   diarization label, {@code null} when not diarized
 * @param segmentStart   absolute start, anchored on the stream's first audio write
 * @param segmentEnd     absolute end, {@code null} for interim events
 * @param text           recognised text
 * @param confidence     0.0..1.0, {@code null} when the engine gives none
 * @param isFinal        finality flag
 * @param resultId       engine-side result identity, {@code null} if the engine has none
 * @param streamSequence sequence number of the emitting stream
 * @param engine         engine name
 * @param model          model name, may be {@code null}
 */
public record TranscriptEvent(
        String speakerId,
        String displayName,
        String speakerLabel,
        Instant segmentStart,
        Instant segmentEnd,
        String text,
        Double confidence,
        boolean isFinal,
        String resultId,
        int streamSequence,
        String engine,
        String model
) {
    public TranscriptEvent {
        Objects.requireNonNull(speakerId, "speakerId must not be null");
        Objects.requireNonNull(segmentStart, "segmentStart must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }
}
