package com.phillippitts.sessionscribe.service.recorder;

/**
 * A track's identity and frame counter read together under the track lock.
 */
public record TrackPosition(long trackId, long frameCount) {
}
