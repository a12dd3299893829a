package com.phillippitts.sessionscribe.service.gate;

import com.phillippitts.sessionscribe.config.properties.SttProperties;
import com.phillippitts.sessionscribe.domain.SessionSpeakerKey;
import com.phillippitts.sessionscribe.service.resampler.ResamplerProcess;
import com.phillippitts.sessionscribe.service.resampler.ResamplerRegistry;
import com.phillippitts.sessionscribe.service.stt.EngineKey;
import com.phillippitts.sessionscribe.service.stt.EngineRegistry;
import com.phillippitts.sessionscribe.service.stt.SttEngine;
import com.phillippitts.sessionscribe.service.stt.TranscriptListener;
import com.phillippitts.sessionscribe.service.usage.UsageTracker;
import com.phillippitts.sessionscribe.service.voice.SignalSubscription;
import com.phillippitts.sessionscribe.service.voice.SpeakingListener;
import com.phillippitts.sessionscribe.service.voice.SpeakingSignalSource;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Owns the {@link VadGate}s of one session and routes speaking edges to them.
 *
 * <p>Caps the number of concurrent gates at {@code stt.max-concurrent-streams}. On every
 * speaking-start the speaker's resampler is checked: if it died or was replaced, the gate is
 * destroyed, the resampler respawned when needed, and a new gate built over the live process.
 *
 * <p>The engine is taken from the shared {@link EngineRegistry} on construction and released on
 * {@link #destroy()}; other sessions using the same engine are unaffected.
 */
public class SttOrchestrator implements SpeakingListener {

    private static final Logger LOG = LogManager.getLogger(SttOrchestrator.class);

    private final String sessionId;
    private final ResamplerRegistry resamplers;
    private final EngineRegistry engines;
    private final EngineKey engineKey;
    private final SttEngine engine;
    private final TranscriptListener downstream;
    private final UsageTracker usage;
    private final SttProperties props;
    private final TaskScheduler scheduler;
    private final MeterRegistry meterRegistry;
    private final ApplicationEventPublisher publisher;
    private final SignalSubscription subscription;

    // @GuardedBy("this")
    private final Map<String, VadGate> gates = new HashMap<>();
    private boolean destroyed;

    public SttOrchestrator(String sessionId,
                           ResamplerRegistry resamplers,
                           EngineRegistry engines,
                           EngineKey engineKey,
                           TranscriptListener downstream,
                           UsageTracker usage,
                           SttProperties props,
                           TaskScheduler scheduler,
                           MeterRegistry meterRegistry,
                           ApplicationEventPublisher publisher,
                           SpeakingSignalSource signals) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.resamplers = Objects.requireNonNull(resamplers, "resamplers");
        this.engines = Objects.requireNonNull(engines, "engines");
        this.engineKey = Objects.requireNonNull(engineKey, "engineKey");
        this.downstream = Objects.requireNonNull(downstream, "downstream");
        this.usage = Objects.requireNonNull(usage, "usage");
        this.props = Objects.requireNonNull(props, "props");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.publisher = publisher;
        this.engine = engines.acquire(engineKey);
        this.subscription = signals.subscribe(this);
    }

    /**
     * Creates a gate for the speaker over their live resampler.
     *
     * @return {@code true} if a gate exists for the speaker afterwards
     */
    public synchronized boolean addUser(String speakerId) {
        if (destroyed) {
            return false;
        }
        if (gates.containsKey(speakerId)) {
            return true;
        }
        if (gates.size() >= props.getMaxConcurrentStreams()) {
            LOG.warn("Session {} at STT capacity ({} speakers); not transcribing {}",
                    sessionId, props.getMaxConcurrentStreams(), speakerId);
            return false;
        }
        ResamplerProcess resampler = resamplers.get(SessionSpeakerKey.of(sessionId, speakerId));
        if (resampler == null) {
            LOG.warn("No live resampler for speaker {} in session {}; not transcribing", speakerId, sessionId);
            return false;
        }
        gates.put(speakerId, newGate(speakerId, resampler));
        LOG.info("Transcription enabled for speaker {} in session {}", speakerId, sessionId);
        return true;
    }

    @Override
    public synchronized void onSpeakingStart(String speakerId) {
        if (destroyed) {
            return;
        }
        VadGate gate = gates.get(speakerId);
        if (gate == null) {
            return;
        }
        SessionSpeakerKey key = SessionSpeakerKey.of(sessionId, speakerId);
        ResamplerProcess resampler = resamplers.get(key);
        if (resampler == null || !gate.isBoundTo(resampler)) {
            gate.destroy();
            gates.remove(speakerId);
            if (resampler == null) {
                LOG.warn("Resampler for {} is gone; respawning", key);
                resampler = resamplers.spawn(key);
                if (resampler == null) {
                    LOG.warn("Resampler respawn refused for {}; speaker not transcribed", key);
                    return;
                }
            }
            gate = newGate(speakerId, resampler);
            gates.put(speakerId, gate);
        }
        gate.onSpeakingStart();
    }

    @Override
    public synchronized void onSpeakingEnd(String speakerId) {
        VadGate gate = gates.get(speakerId);
        if (gate != null) {
            gate.onSpeakingEnd();
        }
    }

    /**
     * Destroys the speaker's gate. No-op if none exists.
     */
    public synchronized void removeUser(String speakerId) {
        VadGate gate = gates.remove(speakerId);
        if (gate != null) {
            gate.destroy();
            LOG.info("Transcription stopped for speaker {} in session {}", speakerId, sessionId);
        }
    }

    /**
     * Destroys every gate, detaches from speaking signals and releases the engine. Idempotent.
     */
    public void destroy() {
        List<VadGate> toDestroy;
        synchronized (this) {
            if (destroyed) {
                return;
            }
            destroyed = true;
            toDestroy = List.copyOf(gates.values());
            gates.clear();
        }
        subscription.close();
        toDestroy.forEach(VadGate::destroy);
        engines.release(engineKey);
        LOG.info("STT orchestrator for session {} destroyed ({} gates)", sessionId, toDestroy.size());
    }

    public synchronized int gateCount() {
        return gates.size();
    }

    public synchronized VadGate gate(String speakerId) {
        return gates.get(speakerId);
    }

    private VadGate newGate(String speakerId, ResamplerProcess resampler) {
        return new VadGate(sessionId, speakerId, resampler, engine, downstream, usage, props,
                scheduler, meterRegistry, publisher);
    }
}
