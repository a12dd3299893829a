package com.phillippitts.sessionscribe.service.hydration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Outcome of hydrating one track.
 *
 * @param bytesWritten raw PCM bytes in the output (silence plus speech)
 */
public record TrackHydration(long trackId, String speakerId, Path output, int burstsWritten, long bytesWritten) {

    public Duration duration() {
        return Duration.ofMillis(bytesWritten * 1000L / PcmFormat.BYTES_PER_SECOND);
    }
}
