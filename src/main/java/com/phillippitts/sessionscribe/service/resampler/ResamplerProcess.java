package com.phillippitts.sessionscribe.service.resampler;

import com.phillippitts.sessionscribe.config.properties.ResamplerProperties;
import com.phillippitts.sessionscribe.domain.SessionSpeakerKey;
import com.phillippitts.sessionscribe.service.ogg.OggOpusMuxer;
import com.phillippitts.sessionscribe.service.process.ProcessStreams;
import com.phillippitts.sessionscribe.util.LogSanitizer;
import com.phillippitts.sessionscribe.util.Timers;
import io.micrometer.core.instrument.Counter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One ffmpeg subprocess converting a speaker's Opus packets to 16-bit mono PCM.
 *
 * <p>Packets passed to {@link #write(byte[])} are queued for a writer thread that wraps them in an
 * Ogg/Opus stream on the process's stdin. PCM read from stdout is fanned out to {@link PcmListener}s.
 *
 * <p><b>Backpressure:</b> when the queue is full the process is marked paused and further input is
 * dropped (and counted) until the writer has emptied the queue. Nothing is buffered beyond the queue.
 *
 * <p><b>Idle watchdog:</b> a process that receives no input for the configured idle timeout is killed.
 *
 * <p><b>Kill:</b> SIGTERM first, then SIGKILL after the grace period if the process is still alive.
 * Idempotent.
 */
public class ResamplerProcess {

    private static final Logger LOG = LogManager.getLogger(ResamplerProcess.class);

    private static final byte[] END_OF_INPUT = new byte[0];
    private static final int READ_BUFFER_SIZE = 4096;
    private static final List<String> DIAGNOSTIC_KEYWORDS = List.of("Error", "error", "Warning");

    /**
     * Notified once when the process has exited.
     */
    @FunctionalInterface
    public interface ExitHandler {
        /**
         * @param intentional {@code true} when the exit follows {@link #kill()}
         */
        void onExit(ResamplerProcess process, int exitCode, boolean intentional);
    }

    private final SessionSpeakerKey key;
    private final Process process;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration idleTimeout;
    private final Duration killGrace;
    private final String vendor;
    private final Counter droppedCounter;
    private final ExitHandler exitHandler;
    private final Instant createdAt;

    private final BlockingQueue<byte[]> pending;
    private final List<PcmListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean alive = new AtomicBoolean(true);
    private final AtomicBoolean killed = new AtomicBoolean(false);
    private final AtomicLong droppedPackets = new AtomicLong();
    private volatile boolean paused;
    private volatile Instant lastWriteAt;

    // @GuardedBy("this")
    private ScheduledFuture<?> idleTimer;
    // @GuardedBy("this")
    private ScheduledFuture<?> hardKillTimer;

    ResamplerProcess(SessionSpeakerKey key,
                     Process process,
                     ResamplerProperties props,
                     String vendor,
                     TaskScheduler scheduler,
                     Counter droppedCounter,
                     ExitHandler exitHandler) {
        this.key = Objects.requireNonNull(key, "key");
        this.process = Objects.requireNonNull(process, "process");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = scheduler.getClock();
        this.idleTimeout = props.getIdleTimeout();
        this.killGrace = props.getKillGrace();
        this.vendor = vendor;
        this.droppedCounter = droppedCounter;
        this.exitHandler = Objects.requireNonNull(exitHandler, "exitHandler");
        this.pending = new ArrayBlockingQueue<>(props.getQueueCapacity());
        this.createdAt = clock.instant();
        this.lastWriteAt = createdAt;
    }

    void start() {
        String suffix = key.speakerId();
        Thread writer = new Thread(this::runWriter, "resampler-in-" + suffix);
        writer.setDaemon(true);
        writer.start();
        Thread reader = new Thread(this::runReader, "resampler-out-" + suffix);
        reader.setDaemon(true);
        reader.start();
        ProcessStreams.drainLines(process.getErrorStream(), "resampler-err-" + suffix, this::onDiagnosticLine);
        armIdleTimer(idleTimeout);
        process.onExit().whenComplete((p, err) -> handleExit());
    }

    /**
     * Queues one Opus packet for conversion.
     *
     * @return {@code false} if the packet was dropped (dead process or backpressure)
     */
    public boolean write(byte[] packet) {
        if (!isAlive()) {
            return false;
        }
        lastWriteAt = clock.instant();
        if (paused && pending.isEmpty()) {
            paused = false;
            LOG.debug("Resampler {} drained; accepting input again", key);
        }
        if (paused || !pending.offer(packet)) {
            if (!paused) {
                paused = true;
                LOG.debug("Resampler {} backpressured; dropping input until drained", key);
            }
            droppedPackets.incrementAndGet();
            if (droppedCounter != null) {
                droppedCounter.increment();
            }
            return false;
        }
        return true;
    }

    public PcmSubscription addPcmListener(PcmListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        AtomicBoolean active = new AtomicBoolean(true);
        return () -> {
            if (active.compareAndSet(true, false)) {
                listeners.remove(listener);
            }
        };
    }

    /**
     * Terminates the process: SIGTERM now, SIGKILL after the grace period if it has not exited.
     * Idempotent and safe after the process has already exited.
     */
    public void kill() {
        if (!killed.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            idleTimer = Timers.cancel(idleTimer);
        }
        pending.clear();
        pending.offer(END_OF_INPUT);
        if (!process.isAlive()) {
            return;
        }
        LOG.debug("Killing resampler {}", key);
        process.destroy();
        synchronized (this) {
            if (alive.get()) {
                hardKillTimer = scheduler.schedule(this::forceKillIfAlive, clock.instant().plus(killGrace));
            }
        }
    }

    public boolean isAlive() {
        return alive.get() && !killed.get();
    }

    public SessionSpeakerKey getKey() {
        return key;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Duration uptime() {
        return Duration.between(createdAt, clock.instant());
    }

    public boolean isPaused() {
        return paused;
    }

    public long getDroppedPackets() {
        return droppedPackets.get();
    }

    int listenerCount() {
        return listeners.size();
    }

    static boolean isDiagnostic(String line) {
        for (String keyword : DIAGNOSTIC_KEYWORDS) {
            if (line.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private void onDiagnosticLine(String line) {
        if (isDiagnostic(line)) {
            LOG.warn("Resampler {} stderr: {}", key, LogSanitizer.sanitize(line, 300));
        }
    }

    private void forceKillIfAlive() {
        if (process.isAlive()) {
            LOG.warn("Resampler {} still alive {} after SIGTERM; sending SIGKILL", key, killGrace);
            process.destroyForcibly();
        }
    }

    private synchronized void armIdleTimer(Duration delay) {
        if (!isAlive()) {
            return;
        }
        idleTimer = scheduler.schedule(this::checkIdle, clock.instant().plus(delay));
    }

    private void checkIdle() {
        Duration quiet = Duration.between(lastWriteAt, clock.instant());
        if (quiet.compareTo(idleTimeout) >= 0) {
            LOG.warn("Resampler {} received no input for {}; killing", key, quiet);
            kill();
        } else {
            armIdleTimer(idleTimeout.minus(quiet));
        }
    }

    private void handleExit() {
        if (!alive.compareAndSet(true, false)) {
            return;
        }
        synchronized (this) {
            idleTimer = Timers.cancel(idleTimer);
            hardKillTimer = Timers.cancel(hardKillTimer);
        }
        pending.clear();
        pending.offer(END_OF_INPUT);
        int exitCode = process.exitValue();
        boolean intentional = killed.get();
        if (intentional) {
            LOG.debug("Resampler {} exited after kill (code {})", key, exitCode);
        } else {
            LOG.info("Resampler {} exited with code {} after {}", key, exitCode, uptime());
        }
        exitHandler.onExit(this, exitCode, intentional);
    }

    private void runWriter() {
        try (OutputStream stdin = new BufferedOutputStream(process.getOutputStream())) {
            OggOpusMuxer muxer = new OggOpusMuxer(stdin, vendor);
            while (true) {
                byte[] packet = pending.take();
                if (packet == END_OF_INPUT) {
                    break;
                }
                muxer.writeFrame(packet);
            }
            muxer.finish();
        } catch (IOException e) {
            if (isAlive()) {
                LOG.warn("Resampler {} stdin closed unexpectedly: {}", key, e.toString());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void runReader() {
        byte[] buffer = new byte[READ_BUFFER_SIZE + 1];
        int held = 0;
        try (InputStream stdout = process.getInputStream()) {
            int n;
            while ((n = stdout.read(buffer, held, READ_BUFFER_SIZE)) != -1) {
                int total = held + n;
                int usable = total & ~1; // whole 16-bit samples only
                if (usable > 0) {
                    deliver(Arrays.copyOf(buffer, usable));
                }
                held = total - usable;
                if (held == 1) {
                    buffer[0] = buffer[usable];
                }
            }
        } catch (IOException e) {
            LOG.debug("Resampler {} stdout reader stopped: {}", key, e.toString());
        }
    }

    private void deliver(byte[] pcm) {
        for (PcmListener listener : listeners) {
            try {
                listener.onPcm(pcm);
            } catch (RuntimeException e) {
                LOG.warn("PCM listener failed for resampler {}", key, e);
            }
        }
    }
}
