package com.phillippitts.sessionscribe.service.transcript;

import com.phillippitts.sessionscribe.domain.Burst;
import com.phillippitts.sessionscribe.domain.Participant;
import com.phillippitts.sessionscribe.domain.TranscriptEvent;
import com.phillippitts.sessionscribe.domain.TranscriptRecord;
import com.phillippitts.sessionscribe.exception.PersistenceException;
import com.phillippitts.sessionscribe.persistence.RecordingStore;
import com.phillippitts.sessionscribe.service.recorder.TrackRecorder;
import com.phillippitts.sessionscribe.service.stt.TranscriptListener;
import com.phillippitts.sessionscribe.util.LogSanitizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Binds transcript events to the speaker's current track and matching burst, then upserts them.
 *
 * <p>Display name resolution order: name on the event, diarization label mapping, participant
 * record. Burst lookup tolerates {@link #BURST_TOLERANCE} either side of the segment start; the
 * last match is cached per speaker until the speaker's track changes.
 */
public class TranscriptWriter implements TranscriptListener {

    private static final Logger LOG = LogManager.getLogger(TranscriptWriter.class);

    static final Duration BURST_TOLERANCE = Duration.ofSeconds(1);

    private final String sessionId;
    private final RecordingStore store;
    private final TrackRecorder recorder;
    private final Counter failedCounter;

    private final Map<String, String> labelNames = new ConcurrentHashMap<>();
    private final Map<String, String> participantNames = new ConcurrentHashMap<>();
    private final Map<String, CachedBurst> burstCache = new ConcurrentHashMap<>();

    public TranscriptWriter(String sessionId, RecordingStore store, TrackRecorder recorder,
                            MeterRegistry meterRegistry) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.store = Objects.requireNonNull(store, "store");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.failedCounter = meterRegistry.counter("stt.transcripts.failed");
    }

    /**
     * Maps a diarization label to a display name.
     */
    public void setSpeakerLabel(String label, String displayName) {
        labelNames.put(label, displayName);
    }

    @Override
    public void onTranscript(TranscriptEvent event) {
        String speakerId = event.speakerId();
        Long trackId = recorder.currentTrackId(speakerId);
        Long burstId = trackId != null ? resolveBurst(speakerId, trackId, event.segmentStart()) : null;
        String displayName = resolveDisplayName(event);
        try {
            store.upsertTranscript(new TranscriptRecord(sessionId, trackId, burstId, displayName, event));
        } catch (PersistenceException e) {
            failedCounter.increment();
            LOG.error("Failed to store transcript for speaker {} sequence {} result {}",
                    speakerId, event.streamSequence(), event.resultId(), e);
            return;
        }
        if (event.isFinal()) {
            LOG.debug("[{}] {}: {}", event.streamSequence(), LogSanitizer.sanitize(displayName),
                    LogSanitizer.sanitize(event.text()));
        }
    }

    String resolveDisplayName(TranscriptEvent event) {
        if (event.displayName() != null) {
            return event.displayName();
        }
        if (event.speakerLabel() != null) {
            String mapped = labelNames.get(event.speakerLabel());
            if (mapped != null) {
                return mapped;
            }
        }
        String name = participantNames.get(event.speakerId());
        if (name == null) {
            refreshParticipants();
            name = participantNames.get(event.speakerId());
        }
        return name != null ? name : event.speakerId();
    }

    Long resolveBurst(String speakerId, long trackId, Instant at) {
        CachedBurst cached = burstCache.get(speakerId);
        if (cached != null && cached.trackId() == trackId && cached.covers(at)) {
            return cached.burst().id();
        }
        Optional<Burst> found = store.findBurstForTimestamp(trackId, at, BURST_TOLERANCE);
        if (found.isEmpty()) {
            burstCache.remove(speakerId);
            return null;
        }
        burstCache.put(speakerId, new CachedBurst(trackId, found.get()));
        return found.get().id();
    }

    private void refreshParticipants() {
        for (Participant participant : store.getParticipants(sessionId)) {
            if (participant.displayName() != null) {
                participantNames.put(participant.speakerId(), participant.displayName());
            }
        }
    }

    /**
     * Open bursts are never cached because their end is still moving.
     */
    private record CachedBurst(long trackId, Burst burst) {

        boolean covers(Instant at) {
            if (burst.endedAt() == null) {
                return false;
            }
            return !at.isBefore(burst.startedAt().minus(BURST_TOLERANCE))
                    && !at.isAfter(burst.endedAt().plus(BURST_TOLERANCE));
        }
    }
}
