package com.phillippitts.sessionscribe.service.hydration;

import com.phillippitts.sessionscribe.exception.HydrationException;
import com.phillippitts.sessionscribe.service.process.ProcessFactory;
import com.phillippitts.sessionscribe.service.process.ProcessStreams;
import com.phillippitts.sessionscribe.util.LogSanitizer;
import com.phillippitts.sessionscribe.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs ffmpeg for offline decode and mix.
 *
 * <p>With low priority enabled, commands run under {@code nice -n 19}; if {@code nice} cannot be
 * started the command is retried directly. Stderr is kept (last {@value #STDERR_TAIL_LINES} lines)
 * for the error message of a failed run.
 */
public class FfmpegRunner implements AudioToolchain {

    private static final Logger LOG = LogManager.getLogger(FfmpegRunner.class);

    static final int STDERR_TAIL_LINES = 20;

    private final ProcessFactory processFactory;
    private final String ffmpegPath;
    private final boolean lowPriority;
    private final Duration timeout;

    public FfmpegRunner(ProcessFactory processFactory, String ffmpegPath, boolean lowPriority) {
        this(processFactory, ffmpegPath, lowPriority, ProcessTimeouts.OFFLINE_FFMPEG_TIMEOUT);
    }

    FfmpegRunner(ProcessFactory processFactory, String ffmpegPath, boolean lowPriority, Duration timeout) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.ffmpegPath = Objects.requireNonNull(ffmpegPath, "ffmpegPath");
        this.lowPriority = lowPriority;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public boolean isAvailable() {
        try {
            Process process = processFactory.start(List.of(ffmpegPath, "-version"), null);
            Thread out = ProcessStreams.drainLines(process.getInputStream(), "ffmpeg-version-out", line -> { });
            Thread err = ProcessStreams.drainLines(process.getErrorStream(), "ffmpeg-version-err", line -> { });
            boolean finished = process.waitFor(ProcessTimeouts.VERSION_PROBE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                LOG.warn("{} -version did not finish within {}", ffmpegPath, ProcessTimeouts.VERSION_PROBE_TIMEOUT);
                return false;
            }
            ProcessStreams.joinQuietly(out, ProcessTimeouts.READER_JOIN_TIMEOUT);
            ProcessStreams.joinQuietly(err, ProcessTimeouts.READER_JOIN_TIMEOUT);
            return process.exitValue() == 0;
        } catch (IOException e) {
            LOG.debug("ffmpeg not runnable at {}: {}", ffmpegPath, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void decodeToPcm(Path container, Path rawOut) {
        run(List.of("-i", container.toString(),
                "-f", "s16le",
                "-ar", String.valueOf(PcmFormat.SAMPLE_RATE),
                "-ac", String.valueOf(PcmFormat.CHANNELS),
                "-y", rawOut.toString()));
    }

    @Override
    public void mix(List<Path> inputs, Path output) {
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("inputs must not be empty");
        }
        List<String> args = new ArrayList<>();
        for (Path input : inputs) {
            args.add("-i");
            args.add(input.toString());
        }
        args.add("-filter_complex");
        args.add(mixFilter(inputs.size()));
        args.add("-y");
        args.add(output.toString());
        run(args);
    }

    static String mixFilter(int inputs) {
        return inputs > 1 ? "amix=inputs=" + inputs + ":duration=longest,loudnorm" : "loudnorm";
    }

    /**
     * Runs ffmpeg with {@code args} and waits for it.
     *
     * @throws HydrationException if ffmpeg cannot start, times out or exits non-zero
     */
    void run(List<String> args) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-hide_banner");
        command.add("-loglevel");
        command.add("warning");
        command.addAll(args);

        Process process = start(command);
        Deque<String> stderrTail = new ArrayDeque<>();
        Thread out = ProcessStreams.drainLines(process.getInputStream(), "ffmpeg-out", line -> { });
        Thread err = ProcessStreams.drainLines(process.getErrorStream(), "ffmpeg-err", line -> {
            synchronized (stderrTail) {
                if (stderrTail.size() == STDERR_TAIL_LINES) {
                    stderrTail.removeFirst();
                }
                stderrTail.addLast(line);
            }
            LOG.debug("ffmpeg: {}", LogSanitizer.sanitize(line));
        });
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new HydrationException("ffmpeg timed out after " + timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new HydrationException("Interrupted while waiting for ffmpeg", e);
        }
        ProcessStreams.joinQuietly(out, ProcessTimeouts.READER_JOIN_TIMEOUT);
        ProcessStreams.joinQuietly(err, ProcessTimeouts.READER_JOIN_TIMEOUT);
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            String tail;
            synchronized (stderrTail) {
                tail = String.join(" | ", stderrTail);
            }
            throw new HydrationException("ffmpeg exited with " + exitCode + ": " + LogSanitizer.sanitize(tail, 500));
        }
    }

    private Process start(List<String> command) {
        if (lowPriority) {
            List<String> niced = new ArrayList<>(List.of("nice", "-n", "19"));
            niced.addAll(command);
            try {
                return processFactory.start(niced, null);
            } catch (IOException e) {
                LOG.debug("nice unavailable ({}); running ffmpeg at normal priority", e.toString());
            }
        }
        try {
            return processFactory.start(command, null);
        } catch (IOException e) {
            throw new HydrationException("Failed to start " + ffmpegPath, e);
        }
    }
}
