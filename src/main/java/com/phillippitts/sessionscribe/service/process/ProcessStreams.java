package com.phillippitts.sessionscribe.service.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Helpers for draining process output streams on daemon threads.
 */
public final class ProcessStreams {

    private static final Logger LOG = LogManager.getLogger(ProcessStreams.class);

    private ProcessStreams() {
        // Utility class - prevent instantiation
    }

    /**
     * Starts a daemon thread that reads {@code in} line by line and hands each line to {@code sink}.
     * The thread ends at end of stream or on the first read error.
     */
    public static Thread drainLines(InputStream in, String threadName, Consumer<String> sink) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sink.accept(line);
                }
            } catch (IOException e) {
                LOG.debug("Line reader '{}' stopped: {}", threadName, e.toString());
            }
        }, threadName);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    public static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
