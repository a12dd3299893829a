package com.phillippitts.sessionscribe.service.gate;

import com.phillippitts.sessionscribe.config.properties.SttProperties;
import com.phillippitts.sessionscribe.domain.TranscriptEvent;
import com.phillippitts.sessionscribe.exception.TranscriptionException;
import com.phillippitts.sessionscribe.service.resampler.PcmSubscription;
import com.phillippitts.sessionscribe.service.resampler.ResamplerProcess;
import com.phillippitts.sessionscribe.service.stt.SttEngine;
import com.phillippitts.sessionscribe.service.stt.SttStream;
import com.phillippitts.sessionscribe.service.stt.SttStreamFailureEvent;
import com.phillippitts.sessionscribe.service.stt.TranscriptListener;
import com.phillippitts.sessionscribe.service.usage.UsageTracker;
import com.phillippitts.sessionscribe.util.Timers;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Opens and closes STT streams for one speaker from speaking edges, feeding them the speaker's PCM.
 *
 * <p><b>Streams.</b> A stream is opened on speaking-start and closed after the silence timeout.
 * Once cumulative speech on a stream reaches the rotation threshold a new stream is opened and the
 * old one stays writable for the overlap window; a second rotation inside that window closes the
 * older stream immediately. Events from the retired stream that start within the dedup window of
 * the new stream's first result are dropped.
 *
 * <p><b>Failures.</b> A stream that closes unexpectedly while the speaker is talking is reopened
 * after the connection cooldown, provided speech has not ended by then.
 *
 * <p><b>Binding.</b> The gate is bound to the resampler it was built with; if that resampler is
 * replaced the gate must be destroyed and rebuilt (see {@link #isBoundTo(ResamplerProcess)}).
 *
 * <p>Thread-safe. State changes happen under one lock; PCM is written to streams outside it.
 */
public class VadGate {

    private static final Logger LOG = LogManager.getLogger(VadGate.class);

    private final String sessionId;
    private final String speakerId;
    private final ResamplerProcess resampler;
    private final SttEngine engine;
    private final TranscriptListener downstream;
    private final UsageTracker usage;
    private final SttProperties props;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final PcmSubscription pcmSubscription;

    private final Counter openedCounter;
    private final Counter rotatedCounter;
    private final Counter dedupCounter;
    private final Counter failedCounter;

    private final Object lock = new Object();
    // @GuardedBy("lock")
    private SttStream current;
    private RetiredStream retired;
    private int sequence;
    private Duration cumulativeSpeech = Duration.ZERO;
    private Instant speechStartedAt;
    private Instant cooldownUntil;
    private Instant firstResultStart;
    private boolean destroyed;
    private ScheduledFuture<?> silenceTimer;
    private ScheduledFuture<?> rotationCheck;
    private ScheduledFuture<?> cooldownReopen;

    public VadGate(String sessionId,
                   String speakerId,
                   ResamplerProcess resampler,
                   SttEngine engine,
                   TranscriptListener downstream,
                   UsageTracker usage,
                   SttProperties props,
                   TaskScheduler scheduler,
                   MeterRegistry meterRegistry,
                   ApplicationEventPublisher publisher) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.speakerId = Objects.requireNonNull(speakerId, "speakerId");
        this.resampler = Objects.requireNonNull(resampler, "resampler");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.downstream = Objects.requireNonNull(downstream, "downstream");
        this.usage = Objects.requireNonNull(usage, "usage");
        this.props = Objects.requireNonNull(props, "props");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = publisher;
        this.openedCounter = Counter.builder("stt.streams.opened").register(meterRegistry);
        this.rotatedCounter = Counter.builder("stt.streams.rotated").register(meterRegistry);
        this.dedupCounter = Counter.builder("stt.transcripts.deduplicated").register(meterRegistry);
        this.failedCounter = Counter.builder("stt.streams.failed").register(meterRegistry);
        this.pcmSubscription = resampler.addPcmListener(this::onPcm);
    }

    public void onSpeakingStart() {
        synchronized (lock) {
            if (destroyed) {
                return;
            }
            Instant now = now();
            silenceTimer = Timers.cancel(silenceTimer);
            if (speechStartedAt == null) {
                speechStartedAt = now;
            }
            if (rotationCheck == null) {
                Duration interval = props.getRotationCheckInterval();
                rotationCheck = scheduler.scheduleAtFixedRate(this::checkRotation, now.plus(interval), interval);
            }
            cooldownReopen = Timers.cancel(cooldownReopen);
            if (current != null && current.isOpen()) {
                return;
            }
            if (cooldownUntil != null && now.isBefore(cooldownUntil)) {
                LOG.debug("Speaker {} in cooldown until {}; deferring stream open", speakerId, cooldownUntil);
                cooldownReopen = scheduler.schedule(this::reopenAfterCooldown, cooldownUntil);
                return;
            }
            openStream(now);
        }
    }

    public void onSpeakingEnd() {
        synchronized (lock) {
            if (destroyed || speechStartedAt == null) {
                return;
            }
            Instant now = now();
            rotationCheck = Timers.cancel(rotationCheck);
            cooldownReopen = Timers.cancel(cooldownReopen);
            Duration elapsed = Duration.between(speechStartedAt, now);
            speechStartedAt = null;
            cumulativeSpeech = cumulativeSpeech.plus(elapsed);
            usage.recordSpeech(elapsed);
            if (current != null && current.isOpen()
                    && cumulativeSpeech.compareTo(props.getStreamRotation()) >= 0) {
                rotate(now);
            }
            silenceTimer = Timers.cancel(silenceTimer);
            silenceTimer = scheduler.schedule(this::onSilenceTimeout, now.plus(props.getSilenceTimeout()));
        }
    }

    /**
     * Reports accrued speech, cancels every timer, closes both streams and detaches from the
     * resampler. Idempotent.
     */
    public void destroy() {
        synchronized (lock) {
            if (destroyed) {
                return;
            }
            destroyed = true;
            if (speechStartedAt != null) {
                usage.recordSpeech(Duration.between(speechStartedAt, now()));
                speechStartedAt = null;
            }
            silenceTimer = Timers.cancel(silenceTimer);
            rotationCheck = Timers.cancel(rotationCheck);
            cooldownReopen = Timers.cancel(cooldownReopen);
            if (retired != null) {
                retired.close();
                retired = null;
            }
            if (current != null) {
                current.close();
                current = null;
            }
        }
        pcmSubscription.close();
        LOG.debug("Gate for speaker {} in session {} destroyed", speakerId, sessionId);
    }

    public boolean isBoundTo(ResamplerProcess process) {
        return resampler == process;
    }

    public String getSpeakerId() {
        return speakerId;
    }

    public int currentSequence() {
        synchronized (lock) {
            return sequence;
        }
    }

    public boolean hasOpenStream() {
        synchronized (lock) {
            return current != null && current.isOpen();
        }
    }

    public boolean hasRetiredStream() {
        synchronized (lock) {
            return retired != null;
        }
    }

    public boolean isSpeaking() {
        synchronized (lock) {
            return speechStartedAt != null;
        }
    }

    public Duration cumulativeSpeech() {
        synchronized (lock) {
            return cumulativeSpeech;
        }
    }

    public boolean isDestroyed() {
        synchronized (lock) {
            return destroyed;
        }
    }

    void onPcm(byte[] pcm) {
        SttStream active;
        SttStream overlapping;
        synchronized (lock) {
            if (destroyed) {
                return;
            }
            active = current;
            overlapping = retired != null ? retired.stream : null;
        }
        if (active != null && active.isOpen()) {
            active.write(pcm);
        }
        if (overlapping != null && overlapping.isOpen()) {
            overlapping.write(pcm);
        }
    }

    void onTranscript(TranscriptEvent event) {
        synchronized (lock) {
            int eventSequence = event.streamSequence();
            if (eventSequence == sequence) {
                if (firstResultStart == null) {
                    firstResultStart = event.segmentStart();
                }
            } else if (eventSequence < sequence && isDuplicateOfOverlap(event)) {
                dedupCounter.increment();
                LOG.debug("Dropped overlap duplicate from speaker {} sequence {} (current {})",
                        speakerId, eventSequence, sequence);
                return;
            }
        }
        downstream.onTranscript(event);
    }

    // @GuardedBy("lock")
    private boolean isDuplicateOfOverlap(TranscriptEvent event) {
        if (retired == null || firstResultStart == null) {
            return false;
        }
        Duration distance = Duration.between(firstResultStart, event.segmentStart()).abs();
        return distance.compareTo(props.getDedupWindow()) <= 0;
    }

    // @GuardedBy("lock")
    private void openStream(Instant now) {
        SttStream stream = createStream();
        if (stream != null) {
            current = stream;
            cooldownUntil = null;
            return;
        }
        startCooldown(now);
    }

    // @GuardedBy("lock")
    private SttStream createStream() {
        int next = sequence + 1;
        try {
            SttStream stream = engine.createStream(speakerId, next, this::onTranscript);
            stream.setOnClose(() -> onUnexpectedClose(stream));
            sequence = next;
            cumulativeSpeech = Duration.ZERO;
            firstResultStart = null;
            openedCounter.increment();
            LOG.debug("Opened stream {} for speaker {}", next, speakerId);
            return stream;
        } catch (TranscriptionException e) {
            failedCounter.increment();
            LOG.warn("Could not open STT stream for speaker {} in session {}: {}", speakerId, sessionId, e.getMessage());
            publishFailure(next, "open failed");
            return null;
        }
    }

    // @GuardedBy("lock")
    private void rotate(Instant now) {
        if (retired != null) {
            LOG.debug("Rotation for speaker {} inside overlap window; closing stream {} early",
                    speakerId, retired.stream.getSequence());
            retired.close();
            retired = null;
        }
        SttStream old = current;
        SttStream replacement = createStream();
        if (replacement == null) {
            LOG.warn("Rotation for speaker {} failed; keeping stream {}", speakerId, old.getSequence());
            return;
        }
        current = replacement;
        rotatedCounter.increment();
        LOG.info("Rotated STT stream for speaker {} to sequence {}", speakerId, replacement.getSequence());
        RetiredStream overlap = new RetiredStream(old);
        overlap.armClose(scheduler.schedule(() -> closeRetired(overlap), now.plus(props.getStreamOverlap())));
        retired = overlap;
    }

    // @GuardedBy("lock")
    private void startCooldown(Instant now) {
        cooldownUntil = now.plus(props.getConnectionCooldown());
        if (speechStartedAt != null) {
            cooldownReopen = Timers.cancel(cooldownReopen);
            cooldownReopen = scheduler.schedule(this::reopenAfterCooldown, cooldownUntil);
        }
    }

    private void closeRetired(RetiredStream overlap) {
        synchronized (lock) {
            if (retired != overlap) {
                return;
            }
            overlap.close();
            retired = null;
            LOG.debug("Overlap window ended for speaker {} stream {}", speakerId, overlap.stream.getSequence());
        }
    }

    private void onSilenceTimeout() {
        synchronized (lock) {
            silenceTimer = null;
            if (destroyed || speechStartedAt != null) {
                return;
            }
            if (current != null) {
                LOG.debug("Silence timeout for speaker {}; closing stream {}", speakerId, current.getSequence());
                current.close();
                current = null;
                cooldownUntil = now().plus(props.getConnectionCooldown());
            }
        }
    }

    private void checkRotation() {
        synchronized (lock) {
            if (destroyed || speechStartedAt == null || current == null || !current.isOpen()) {
                return;
            }
            Instant now = now();
            Duration elapsed = Duration.between(speechStartedAt, now);
            if (cumulativeSpeech.plus(elapsed).compareTo(props.getStreamRotation()) < 0) {
                return;
            }
            usage.recordSpeech(elapsed);
            cumulativeSpeech = cumulativeSpeech.plus(elapsed);
            speechStartedAt = now;
            rotate(now);
        }
    }

    private void onUnexpectedClose(SttStream stream) {
        synchronized (lock) {
            if (destroyed || stream != current) {
                return;
            }
            current = null;
            failedCounter.increment();
            publishFailure(stream.getSequence(), "closed unexpectedly");
            if (speechStartedAt == null) {
                LOG.debug("Stream {} for speaker {} closed after speech ended", stream.getSequence(), speakerId);
                return;
            }
            LOG.warn("Stream {} for speaker {} closed mid-utterance; reopening after {}",
                    stream.getSequence(), speakerId, props.getConnectionCooldown());
            startCooldown(now());
        }
    }

    private void reopenAfterCooldown() {
        synchronized (lock) {
            cooldownReopen = null;
            if (destroyed || speechStartedAt == null || (current != null && current.isOpen())) {
                return;
            }
            openStream(now());
        }
    }

    private void publishFailure(int streamSequence, String reason) {
        if (publisher != null) {
            publisher.publishEvent(new SttStreamFailureEvent(sessionId, speakerId, streamSequence,
                    engine.getEngineName(), now(), reason));
        }
    }

    private Instant now() {
        return scheduler.getClock().instant();
    }
}
