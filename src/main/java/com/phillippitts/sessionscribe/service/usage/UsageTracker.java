package com.phillippitts.sessionscribe.service.usage;

import com.phillippitts.sessionscribe.domain.UsageRecord;
import com.phillippitts.sessionscribe.persistence.RecordingStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;

/**
 * Accumulates transcribed speech time for one session and engine and estimates its cost.
 *
 * <p>Cost model: billed minutes x {@value #USD_PER_MINUTE} USD x {@value #OVERHEAD_FACTOR} overhead.
 * A single warning is logged the first time the estimate exceeds the configured threshold.
 */
public class UsageTracker {

    private static final Logger LOG = LogManager.getLogger(UsageTracker.class);

    static final double USD_PER_MINUTE = 0.024;
    static final double OVERHEAD_FACTOR = 1.2;

    private final String sessionId;
    private final String engine;
    private final RecordingStore store;
    private final double warningThresholdUsd;
    private final Counter speechSeconds;

    // @GuardedBy("this")
    private long speechMillis;
    private boolean warned;

    public UsageTracker(String sessionId,
                        String engine,
                        RecordingStore store,
                        double warningThresholdUsd,
                        MeterRegistry meterRegistry) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.store = Objects.requireNonNull(store, "store");
        this.warningThresholdUsd = warningThresholdUsd;
        this.speechSeconds = Counter.builder("stt.speech.seconds")
                .tag("engine", engine)
                .register(meterRegistry);
    }

    /**
     * Adds speech time. Zero and negative durations are ignored.
     */
    public void recordSpeech(Duration speech) {
        if (speech == null || speech.isZero() || speech.isNegative()) {
            return;
        }
        double cost;
        synchronized (this) {
            speechMillis += speech.toMillis();
            cost = costFor(speechMillis);
            if (warned || cost <= warningThresholdUsd) {
                cost = -1;
            } else {
                warned = true;
            }
        }
        speechSeconds.increment(speech.toMillis() / 1000.0);
        if (cost >= 0) {
            LOG.warn("Session {} estimated STT cost ${} exceeds ${}",
                    sessionId, String.format("%.2f", cost), warningThresholdUsd);
        }
    }

    public synchronized Duration totalSpeech() {
        return Duration.ofMillis(speechMillis);
    }

    public synchronized double estimatedCostUsd() {
        return costFor(speechMillis);
    }

    /**
     * Persists the running totals. Safe to call repeatedly; the store keeps the latest values.
     */
    public void flush() {
        UsageRecord usage;
        synchronized (this) {
            usage = new UsageRecord(sessionId, engine, speechMillis / 1000.0, costFor(speechMillis));
        }
        store.upsertUsage(usage);
        LOG.info("Session {} STT usage: {}s speech, estimated ${}",
                sessionId, usage.speechSeconds(), String.format("%.4f", usage.estimatedCostUsd()));
    }

    static double costFor(long millis) {
        return millis / 60_000.0 * USD_PER_MINUTE * OVERHEAD_FACTOR;
    }
}
