package com.phillippitts.sessionscribe.service.resampler;

import com.phillippitts.sessionscribe.config.properties.RecordingProperties;
import com.phillippitts.sessionscribe.config.properties.ResamplerProperties;
import com.phillippitts.sessionscribe.domain.SessionSpeakerKey;
import com.phillippitts.sessionscribe.service.process.ProcessFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide owner of resampler subprocesses, one per (session, speaker).
 *
 * <p><b>Circuit breaker:</b> a process that exits on its own within the early-exit window after spawn
 * (or fails to start at all) counts as a spawn failure. Once the failure threshold is reached inside
 * the breaker window, {@link #spawn(SessionSpeakerKey)} returns {@code null} until old failures age out.
 * Exits caused by {@link #kill(SessionSpeakerKey)} never count.
 *
 * <p><b>Ownership:</b> callers hold a {@link ResamplerProcess} only as long as {@link #get} keeps
 * returning the same instance. After a respawn the old instance is dead and must be dropped.
 *
 * <p><b>Thread Safety:</b> spawn and kill for the same key are serialised on a per-key lock.
 */
public class ResamplerRegistry {

    private static final Logger LOG = LogManager.getLogger(ResamplerRegistry.class);

    private final ProcessFactory processFactory;
    private final ResamplerProperties props;
    private final String vendor;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final SpawnCircuitBreaker breaker;

    private final ConcurrentMap<SessionSpeakerKey, ResamplerProcess> processes = new ConcurrentHashMap<>();
    private final ConcurrentMap<SessionSpeakerKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    private final Counter spawnCounter;
    private final Counter refusedCounter;
    private final Counter earlyExitCounter;
    private final Counter droppedCounter;

    public ResamplerRegistry(ProcessFactory processFactory,
                             ResamplerProperties props,
                             RecordingProperties recordingProps,
                             TaskScheduler scheduler,
                             MeterRegistry meterRegistry,
                             ApplicationEventPublisher publisher) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.props = Objects.requireNonNull(props, "props");
        this.vendor = recordingProps.getVendor();
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = publisher;
        this.breaker = new SpawnCircuitBreaker(scheduler.getClock(), props.getBreakerWindow(), props.getBreakerThreshold());
        this.spawnCounter = Counter.builder("resampler.spawns").register(meterRegistry);
        this.refusedCounter = Counter.builder("resampler.spawn.refused").register(meterRegistry);
        this.earlyExitCounter = Counter.builder("resampler.early.exits").register(meterRegistry);
        this.droppedCounter = Counter.builder("resampler.writes.dropped").register(meterRegistry);
        Gauge.builder("resampler.active", processes, ConcurrentMap::size).register(meterRegistry);
    }

    /**
     * Starts a fresh resampler for {@code key}, killing any existing one first.
     *
     * @return the new process, or {@code null} if the circuit breaker is open or the start failed
     */
    public ResamplerProcess spawn(SessionSpeakerKey key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            if (breaker.isOpen(key)) {
                refusedCounter.increment();
                LOG.warn("Resampler spawn refused for {}: {} early failures within {}",
                        key, breaker.failureCount(key), props.getBreakerWindow());
                return null;
            }
            killUnlocked(key);

            Process process;
            try {
                process = processFactory.start(command(), null);
            } catch (IOException e) {
                breaker.recordFailure(key);
                LOG.error("Failed to start resampler for {}: {}", key, e.toString());
                publishFailure(key, "spawn failed: " + e.getMessage(), null);
                return null;
            }

            ResamplerProcess resampler = new ResamplerProcess(key, process, props, vendor, scheduler,
                    droppedCounter, this::onProcessExit);
            processes.put(key, resampler);
            resampler.start();
            spawnCounter.increment();
            LOG.info("Resampler spawned for {}", key);
            return resampler;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the live process for {@code key}, or {@code null}; dead entries are evicted
     */
    public ResamplerProcess get(SessionSpeakerKey key) {
        ResamplerProcess resampler = processes.get(key);
        if (resampler == null) {
            return null;
        }
        if (!resampler.isAlive()) {
            processes.remove(key, resampler);
            return null;
        }
        return resampler;
    }

    /** Kills the process for {@code key} if any. Idempotent. */
    public void kill(SessionSpeakerKey key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            killUnlocked(key);
        } finally {
            lock.unlock();
        }
    }

    /** Kills every process belonging to {@code sessionId} and forgets their breaker history. */
    public void killSession(String sessionId) {
        for (SessionSpeakerKey key : new ArrayList<>(processes.keySet())) {
            if (key.sessionId().equals(sessionId)) {
                kill(key);
            }
        }
        for (SessionSpeakerKey key : new ArrayList<>(locks.keySet())) {
            if (key.sessionId().equals(sessionId)) {
                breaker.forget(key);
                locks.remove(key);
            }
        }
    }

    @PreDestroy
    public void killAll() {
        List<SessionSpeakerKey> keys = new ArrayList<>(processes.keySet());
        for (SessionSpeakerKey key : keys) {
            kill(key);
        }
        if (!keys.isEmpty()) {
            LOG.info("Killed {} resampler(s)", keys.size());
        }
    }

    public boolean isCircuitOpen(SessionSpeakerKey key) {
        return breaker.isOpen(key);
    }

    public SpawnCircuitBreaker getBreaker() {
        return breaker;
    }

    public int size() {
        return processes.size();
    }

    List<String> command() {
        return List.of(
                props.getFfmpegPath(),
                "-hide_banner",
                "-loglevel", "warning",
                "-f", "ogg",
                "-i", "pipe:0",
                "-ar", String.valueOf(props.getOutputSampleRate()),
                "-ac", "1",
                "-f", "s16le",
                "pipe:1");
    }

    private void killUnlocked(SessionSpeakerKey key) {
        ResamplerProcess existing = processes.remove(key);
        if (existing != null) {
            existing.kill();
        }
    }

    private void onProcessExit(ResamplerProcess resampler, int exitCode, boolean intentional) {
        SessionSpeakerKey key = resampler.getKey();
        processes.remove(key, resampler);
        if (intentional) {
            return;
        }
        if (resampler.uptime().compareTo(props.getEarlyExitWindow()) < 0) {
            breaker.recordFailure(key);
            earlyExitCounter.increment();
            LOG.warn("Resampler for {} exited {} after spawn (code {}); failure {} of {} in window",
                    key, resampler.uptime(), exitCode, breaker.failureCount(key), props.getBreakerThreshold());
            publishFailure(key, "early exit", exitCode);
        }
    }

    private void publishFailure(SessionSpeakerKey key, String reason, Integer exitCode) {
        if (publisher != null) {
            publisher.publishEvent(new ResamplerFailureEvent(key, scheduler.getClock().instant(), reason, exitCode));
        }
    }
}
