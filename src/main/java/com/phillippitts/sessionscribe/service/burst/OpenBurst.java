package com.phillippitts.sessionscribe.service.burst;

import com.phillippitts.sessionscribe.util.Timers;

import java.util.concurrent.ScheduledFuture;

/**
 * An open burst together with the max-duration watchdog that belongs to it.
 * Releasing the burst cancels the watchdog, so the timer can never outlive the burst.
 */
final class OpenBurst {

    final String speakerId;
    final long burstId;
    final long trackId;
    final long startFrameOffset;
    private ScheduledFuture<?> watchdog;

    OpenBurst(String speakerId, long burstId, long trackId, long startFrameOffset) {
        this.speakerId = speakerId;
        this.burstId = burstId;
        this.trackId = trackId;
        this.startFrameOffset = startFrameOffset;
    }

    void arm(ScheduledFuture<?> timer) {
        watchdog = Timers.cancel(watchdog);
        watchdog = timer;
    }

    void release() {
        watchdog = Timers.cancel(watchdog);
    }

    boolean isArmed() {
        return watchdog != null;
    }
}
