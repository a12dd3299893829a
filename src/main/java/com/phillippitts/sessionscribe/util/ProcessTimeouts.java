package com.phillippitts.sessionscribe.util;

import java.time.Duration;

/**
 * Timeouts shared by code that manages external processes.
 */
public final class ProcessTimeouts {

    /** Time allowed for a stream-reader thread to finish after its process exits. */
    public static final Duration READER_JOIN_TIMEOUT = Duration.ofMillis(500);

    /** Upper bound for a single offline ffmpeg decode/encode invocation. */
    public static final Duration OFFLINE_FFMPEG_TIMEOUT = Duration.ofHours(2);

    /** Upper bound for {@code ffmpeg -version}. */
    public static final Duration VERSION_PROBE_TIMEOUT = Duration.ofSeconds(10);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
