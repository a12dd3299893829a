package com.phillippitts.sessionscribe.service.session;

import com.phillippitts.sessionscribe.config.properties.RecordingProperties;
import com.phillippitts.sessionscribe.config.properties.SttProperties;
import com.phillippitts.sessionscribe.domain.Participant;
import com.phillippitts.sessionscribe.domain.RecordingSession;
import com.phillippitts.sessionscribe.domain.SessionSpeakerKey;
import com.phillippitts.sessionscribe.domain.SessionStatus;
import com.phillippitts.sessionscribe.exception.SessionScribeException;
import com.phillippitts.sessionscribe.exception.TranscriptionException;
import com.phillippitts.sessionscribe.persistence.RecordingStore;
import com.phillippitts.sessionscribe.service.burst.BurstTracker;
import com.phillippitts.sessionscribe.service.gate.SttOrchestrator;
import com.phillippitts.sessionscribe.service.recorder.TrackRecorder;
import com.phillippitts.sessionscribe.service.resampler.ResamplerRegistry;
import com.phillippitts.sessionscribe.service.stt.EngineKey;
import com.phillippitts.sessionscribe.service.stt.EngineRegistry;
import com.phillippitts.sessionscribe.service.transcript.TranscriptWriter;
import com.phillippitts.sessionscribe.service.usage.UsageTracker;
import com.phillippitts.sessionscribe.service.voice.VoiceTransport;
import com.phillippitts.sessionscribe.util.LogSanitizer;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single owner of every running session. Wires recorder, burst tracker, resamplers and STT
 * for a session and tears them down in a fixed order.
 *
 * <p>Teardown order for a leaving speaker: close burst, stop transcription, close track, kill
 * resampler, mark the participant left. Bursts close before the track so their end offset can
 * still be read from the recorder.
 *
 * <p>At most one active session per guild.
 */
@Service
public class SessionManager {

    private static final Logger LOG = LogManager.getLogger(SessionManager.class);

    static final String MDC_SESSION = "sessionId";

    private final RecordingStore store;
    private final ResamplerRegistry resamplers;
    private final EngineRegistry engines;
    private final RecordingProperties recordingProps;
    private final SttProperties sttProps;
    private final TaskScheduler scheduler;
    private final MeterRegistry meterRegistry;
    private final ApplicationEventPublisher publisher;

    private final ConcurrentMap<String, ActiveSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> sessionsByGuild = new ConcurrentHashMap<>();

    public SessionManager(RecordingStore store,
                          ResamplerRegistry resamplers,
                          EngineRegistry engines,
                          RecordingProperties recordingProps,
                          SttProperties sttProps,
                          TaskScheduler scheduler,
                          MeterRegistry meterRegistry,
                          ApplicationEventPublisher publisher) {
        this.store = Objects.requireNonNull(store, "store");
        this.resamplers = Objects.requireNonNull(resamplers, "resamplers");
        this.engines = Objects.requireNonNull(engines, "engines");
        this.recordingProps = Objects.requireNonNull(recordingProps, "recordingProps");
        this.sttProps = Objects.requireNonNull(sttProps, "sttProps");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.publisher = publisher;
    }

    /**
     * Starts recording a voice channel and subscribes everyone already present.
     *
     * @param participants speaker id to display name, in join order
     * @return the new session id
     * @throws SessionScribeException if the guild already has an active session
     */
    public synchronized String startSession(VoiceTransport transport,
                                            String guildId,
                                            String channelId,
                                            Map<String, String> participants) {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(guildId, "guildId");
        if (sessionsByGuild.containsKey(guildId)) {
            throw new SessionScribeException("Guild " + guildId + " already has an active session "
                    + sessionsByGuild.get(guildId));
        }
        String sessionId = UUID.randomUUID().toString();
        ThreadContext.put(MDC_SESSION, sessionId);
        try {
            Clock clock = scheduler.getClock();
            store.insertSession(new RecordingSession(sessionId, guildId, channelId, clock.instant(), null,
                    SessionStatus.ACTIVE));

            TrackRecorder recorder = new TrackRecorder(sessionId, transport, store,
                    sttProps.isEnabled() ? resamplers : null, recordingProps, clock, meterRegistry, publisher);
            BurstTracker bursts = new BurstTracker(sessionId, recorder, store, transport.speakingSignals(),
                    scheduler, recordingProps.getMaxBurstDuration());

            UsageTracker usage = null;
            TranscriptWriter transcripts = null;
            SttOrchestrator orchestrator = null;
            if (sttProps.isEnabled()) {
                usage = new UsageTracker(sessionId, sttProps.getEngine(), store,
                        sttProps.getCostWarningPerSessionUsd(), meterRegistry);
                transcripts = new TranscriptWriter(sessionId, store, recorder, meterRegistry);
                orchestrator = startTranscription(sessionId, transport, transcripts, usage);
                if (orchestrator == null) {
                    usage = null;
                    transcripts = null;
                }
            }

            ActiveSession session = new ActiveSession(sessionId, guildId, transport, recorder, bursts,
                    orchestrator, usage, transcripts);
            sessions.put(sessionId, session);
            sessionsByGuild.put(guildId, sessionId);
            LOG.info("Session {} started in guild {} channel {} (transcription {})",
                    sessionId, guildId, channelId, session.transcribing() ? "on" : "off");

            participants.forEach((speakerId, name) -> join(session, speakerId, name));
            return sessionId;
        } finally {
            ThreadContext.remove(MDC_SESSION);
        }
    }

    /**
     * Late join or rejoin: a rejoining speaker gets a new track file.
     */
    public void participantJoined(String sessionId, String speakerId, String displayName) {
        ActiveSession session = require(sessionId);
        ThreadContext.put(MDC_SESSION, sessionId);
        try {
            join(session, speakerId, displayName);
        } finally {
            ThreadContext.remove(MDC_SESSION);
        }
    }

    /**
     * Tears down everything held for the speaker. Safe to call for a speaker who already left.
     */
    public void participantLeft(String sessionId, String speakerId) {
        ActiveSession session = require(sessionId);
        ThreadContext.put(MDC_SESSION, sessionId);
        try {
            session.bursts.closeUserBurst(speakerId);
            if (session.transcribing()) {
                session.orchestrator.removeUser(speakerId);
            }
            session.recorder.close(speakerId);
            resamplers.kill(SessionSpeakerKey.of(sessionId, speakerId));
            store.markParticipantLeft(sessionId, speakerId, scheduler.getClock().instant());
            LOG.info("Speaker {} left session {}", speakerId, sessionId);
        } finally {
            ThreadContext.remove(MDC_SESSION);
        }
    }

    /**
     * Stops the session and marks it {@link SessionStatus#STOPPED}. No-op for an unknown or already
     * stopped session.
     */
    public void stopSession(String sessionId) {
        stop(sessionId, SessionStatus.STOPPED);
    }

    @PreDestroy
    public void stopAll() {
        List.copyOf(sessions.keySet()).forEach(this::stopSession);
    }

    public Optional<String> activeSessionForGuild(String guildId) {
        return Optional.ofNullable(sessionsByGuild.get(guildId));
    }

    public boolean isActive(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public int activeCount() {
        return sessions.size();
    }

    TrackRecorder recorder(String sessionId) {
        return require(sessionId).recorder;
    }

    SttOrchestrator orchestrator(String sessionId) {
        return require(sessionId).orchestrator;
    }

    private void stop(String sessionId, SessionStatus status) {
        ActiveSession session;
        synchronized (this) {
            session = sessions.remove(sessionId);
            if (session == null) {
                return;
            }
            sessionsByGuild.remove(session.guildId, sessionId);
        }
        ThreadContext.put(MDC_SESSION, sessionId);
        try {
            session.bursts.destroy();
            if (session.transcribing()) {
                session.orchestrator.destroy();
                session.usage.flush();
            }
            session.recorder.closeAll();
            resamplers.killSession(sessionId);
            Instant now = scheduler.getClock().instant();
            for (Participant participant : store.getParticipants(sessionId)) {
                if (participant.leftAt() == null) {
                    store.markParticipantLeft(sessionId, participant.speakerId(), now);
                }
            }
            store.endSession(sessionId, now, status);
            session.transport.disconnect();
            LOG.info("Session {} ended ({})", sessionId, status);
        } finally {
            ThreadContext.remove(MDC_SESSION);
        }
    }

    private void join(ActiveSession session, String speakerId, String displayName) {
        Instant now = scheduler.getClock().instant();
        store.insertParticipant(new Participant(session.sessionId, speakerId, displayName, now, null));
        session.recorder.subscribe(speakerId);
        if (session.transcribing()) {
            SessionSpeakerKey key = SessionSpeakerKey.of(session.sessionId, speakerId);
            if (resamplers.get(key) == null && resamplers.spawn(key) == null) {
                LOG.warn("No resampler for {}; recording without transcription", key);
            } else {
                session.orchestrator.addUser(speakerId);
            }
        }
        LOG.info("Speaker {} ({}) joined session {}", speakerId, LogSanitizer.sanitize(displayName),
                session.sessionId);
    }

    private SttOrchestrator startTranscription(String sessionId,
                                               VoiceTransport transport,
                                               TranscriptWriter transcripts,
                                               UsageTracker usage) {
        EngineKey key = new EngineKey(sttProps.getEngine(), sttProps.getModelPath());
        try {
            return new SttOrchestrator(sessionId, resamplers, engines, key, transcripts, usage, sttProps,
                    scheduler, meterRegistry, publisher, transport.speakingSignals());
        } catch (TranscriptionException e) {
            LOG.error("STT engine {} unavailable; session {} records audio only", key, sessionId, e);
            return null;
        }
    }

    private ActiveSession require(String sessionId) {
        ActiveSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionScribeException("No active session " + sessionId);
        }
        return session;
    }
}
