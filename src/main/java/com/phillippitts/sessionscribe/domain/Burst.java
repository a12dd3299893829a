package com.phillippitts.sessionscribe.domain;

import java.time.Instant;

/**
 * A contiguous span of detected speech within one track.
 *
 * <p>Frame offsets index into the owning track's frame counter. {@code endedAt} and
 * {@code endFrameOffset} are {@code null} while the burst is open.
 */
public record Burst(
        long id,
        long trackId,
        Instant startedAt,
        Instant endedAt,
        long startFrameOffset,
        Long endFrameOffset
) {
    public Burst {
        if (startFrameOffset < 0) {
            throw new IllegalArgumentException("startFrameOffset must be >= 0, got: " + startFrameOffset);
        }
        if (endFrameOffset != null && endFrameOffset < startFrameOffset) {
            throw new IllegalArgumentException(
                    "endFrameOffset " + endFrameOffset + " precedes startFrameOffset " + startFrameOffset);
        }
    }

    public boolean isOpen() {
        return endedAt == null;
    }

    public Burst closedAt(Instant at, long frameOffset) {
        return new Burst(id, trackId, startedAt, at, startFrameOffset, frameOffset);
    }
}
