package com.phillippitts.sessionscribe.service.recorder;

import java.time.Instant;

/**
 * Published (throttled) when a track receives a packet whose duration is not 20 ms.
 * The packet is still recorded; frame-offset arithmetic for that track may drift.
 *
 * @param frameIndex     index the packet was written at
 * @param durationMicros packet duration, 0 if unknown
 */
public record NonStandardFrameEvent(String sessionId, String speakerId, long trackId, long frameIndex,
                                    int durationMicros, Instant at) {
}
