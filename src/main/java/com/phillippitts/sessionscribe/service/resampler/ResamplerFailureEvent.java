package com.phillippitts.sessionscribe.service.resampler;

import com.phillippitts.sessionscribe.domain.SessionSpeakerKey;

import java.time.Instant;

/**
 * Published when a resampler could not be started or exited shortly after spawn.
 *
 * @param exitCode exit status, {@code null} when the process never started
 */
public record ResamplerFailureEvent(SessionSpeakerKey key, Instant at, String reason, Integer exitCode) {
}
