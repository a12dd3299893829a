package com.phillippitts.sessionscribe.service.resampler;

import com.phillippitts.sessionscribe.domain.SessionSpeakerKey;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Sliding-window failure counter per (session, speaker).
 *
 * <p>The breaker is open for a key while at least {@code threshold} failures fall inside the last
 * {@code window}. It closes again by itself once old failures age out; there is no explicit half-open
 * state.
 */
public class SpawnCircuitBreaker {

    private final Clock clock;
    private final Duration window;
    private final int threshold;
    private final ConcurrentMap<SessionSpeakerKey, Deque<Instant>> failures = new ConcurrentHashMap<>();

    public SpawnCircuitBreaker(Clock clock, Duration window, int threshold) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.window = Objects.requireNonNull(window, "window");
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive, got: " + threshold);
        }
        this.threshold = threshold;
    }

    public void recordFailure(SessionSpeakerKey key) {
        Deque<Instant> deque = failures.computeIfAbsent(key, k -> new ArrayDeque<>());
        synchronized (deque) {
            pruneOld(deque);
            deque.addLast(clock.instant());
        }
    }

    public boolean isOpen(SessionSpeakerKey key) {
        return failureCount(key) >= threshold;
    }

    public int failureCount(SessionSpeakerKey key) {
        Deque<Instant> deque = failures.get(key);
        if (deque == null) {
            return 0;
        }
        synchronized (deque) {
            pruneOld(deque);
            return deque.size();
        }
    }

    /** Number of keys whose breaker is currently open. */
    public long openCount() {
        return failures.keySet().stream().filter(this::isOpen).count();
    }

    public void forget(SessionSpeakerKey key) {
        failures.remove(key);
    }

    private void pruneOld(Deque<Instant> deque) {
        Instant cutoff = clock.instant().minus(window);
        while (!deque.isEmpty() && !deque.peekFirst().isAfter(cutoff)) {
            deque.removeFirst();
        }
    }
}
