package com.phillippitts.sessionscribe.util;

import java.util.concurrent.Future;

/**
 * Null-safe cancellation for timer handles.
 *
 * <p>Intended for the {@code field = Timers.cancel(field)} idiom, which cancels the timer
 * and clears the reference in one statement.
 */
public final class Timers {

    private Timers() {
        // Utility class - prevent instantiation
    }

    public static <T extends Future<?>> T cancel(T future) {
        if (future != null) {
            future.cancel(false);
        }
        return null;
    }
}
