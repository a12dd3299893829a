package com.phillippitts.sessionscribe.service.gate;

import com.phillippitts.sessionscribe.service.stt.SttStream;
import com.phillippitts.sessionscribe.util.Timers;

import java.util.concurrent.ScheduledFuture;

/**
 * A stream kept writable for the overlap window after a rotation, with the timer that closes it.
 */
final class RetiredStream {

    final SttStream stream;
    private ScheduledFuture<?> closeTimer;

    RetiredStream(SttStream stream) {
        this.stream = stream;
    }

    void armClose(ScheduledFuture<?> timer) {
        closeTimer = Timers.cancel(closeTimer);
        closeTimer = timer;
    }

    /**
     * Cancels the overlap timer and closes the stream now. Idempotent.
     */
    void close() {
        closeTimer = Timers.cancel(closeTimer);
        stream.close();
    }
}
