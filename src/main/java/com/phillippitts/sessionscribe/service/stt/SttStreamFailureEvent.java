package com.phillippitts.sessionscribe.service.stt;

import java.time.Instant;

/**
 * Published when a stream closes unexpectedly or cannot be opened.
 *
 * <p>Never carries transcript text.
 */
public record SttStreamFailureEvent(
        String sessionId,
        String speakerId,
        int sequence,
        String engine,
        Instant at,
        String reason
) {
    public SttStreamFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
