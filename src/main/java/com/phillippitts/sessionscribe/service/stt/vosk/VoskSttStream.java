package com.phillippitts.sessionscribe.service.stt.vosk;

import com.phillippitts.sessionscribe.domain.TranscriptEvent;
import com.phillippitts.sessionscribe.service.stt.SttEngineNames;
import com.phillippitts.sessionscribe.service.stt.SttStream;
import com.phillippitts.sessionscribe.service.stt.TranscriptListener;
import com.phillippitts.sessionscribe.service.stt.vosk.VoskJsonParser.VoskResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.vosk.Recognizer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Streaming recogniser session over one {@link Recognizer}.
 *
 * <p>An utterance boundary reported by the recogniser yields a final event; otherwise a changed
 * partial hypothesis yields an interim event, at most {@code interimsPerSecond} times a second.
 * Interims and the final of one utterance share the result id {@code u{n}}.
 *
 * <p>Offsets reported by the recogniser are relative to the first audio it received, so absolute
 * times are anchored on the first {@link #write(byte[])}, not on construction.
 *
 * <p>Events are delivered after the internal lock is released.
 */
final class VoskSttStream implements SttStream {

    private static final Logger LOG = LogManager.getLogger(VoskSttStream.class);

    private final String speakerId;
    private final int sequence;
    private final Recognizer recognizer;
    private final TranscriptListener listener;
    private final Clock clock;
    private final int bytesPerSecond;
    private final Duration interimInterval;
    private final String model;

    private final Object lock = new Object();
    // @GuardedBy("lock")
    private boolean open = true;
    private Instant anchor;
    private long bytesFed;
    private long utteranceStartBytes;
    private int utteranceIndex;
    private Instant lastInterimAt;
    private String lastPartial = "";
    private Runnable onClose;

    VoskSttStream(String speakerId,
                  int sequence,
                  Recognizer recognizer,
                  TranscriptListener listener,
                  Clock clock,
                  int sampleRateHertz,
                  int interimsPerSecond,
                  String model) {
        this.speakerId = speakerId;
        this.sequence = sequence;
        this.recognizer = recognizer;
        this.listener = listener;
        this.clock = clock;
        this.bytesPerSecond = sampleRateHertz * 2;
        this.interimInterval = Duration.ofMillis(1000L / Math.max(1, interimsPerSecond));
        this.model = model;
    }

    @Override
    public void write(byte[] pcm) {
        if (pcm == null || pcm.length == 0) {
            return;
        }
        List<TranscriptEvent> events = new ArrayList<>(1);
        Runnable failureCallback = null;
        synchronized (lock) {
            if (!open) {
                return;
            }
            if (anchor == null) {
                anchor = clock.instant();
            }
            try {
                boolean endOfUtterance = recognizer.acceptWaveForm(pcm, pcm.length);
                bytesFed += pcm.length;
                if (endOfUtterance) {
                    addFinal(events, recognizer.getResult());
                } else {
                    addInterim(events, recognizer.getPartialResult());
                }
            } catch (RuntimeException e) {
                LOG.warn("Recogniser failed for speaker {} sequence {}; closing stream", speakerId, sequence, e);
                open = false;
                closeRecognizer();
                failureCallback = onClose;
            }
        }
        deliver(events);
        if (failureCallback != null) {
            failureCallback.run();
        }
    }

    @Override
    public void close() {
        List<TranscriptEvent> events = new ArrayList<>(1);
        synchronized (lock) {
            if (!open) {
                return;
            }
            open = false;
            if (anchor != null) {
                try {
                    addFinal(events, recognizer.getFinalResult());
                } catch (RuntimeException e) {
                    LOG.warn("Failed to flush final result for speaker {} sequence {}", speakerId, sequence, e);
                }
            }
            closeRecognizer();
        }
        deliver(events);
        LOG.debug("Stream {} for speaker {} closed", sequence, speakerId);
    }

    @Override
    public boolean isOpen() {
        synchronized (lock) {
            return open;
        }
    }

    @Override
    public int getSequence() {
        return sequence;
    }

    @Override
    public void setOnClose(Runnable onClose) {
        synchronized (lock) {
            this.onClose = onClose;
        }
    }

    // @GuardedBy("lock")
    private void addFinal(List<TranscriptEvent> events, String json) {
        VoskResult result = VoskJsonParser.parseFinal(json);
        String resultId = "u" + utteranceIndex;
        Instant start = result.startSeconds() != null
                ? offset(result.startSeconds()) : anchor.plus(bytesToDuration(utteranceStartBytes));
        Instant end = result.endSeconds() != null
                ? offset(result.endSeconds()) : anchor.plus(bytesToDuration(bytesFed));
        utteranceIndex++;
        utteranceStartBytes = bytesFed;
        lastPartial = "";
        lastInterimAt = null;
        if (result.isEmpty()) {
            return;
        }
        events.add(new TranscriptEvent(speakerId, null, null, start, end, result.text(), result.confidence(),
                true, resultId, sequence, SttEngineNames.VOSK, model));
    }

    // @GuardedBy("lock")
    private void addInterim(List<TranscriptEvent> events, String json) {
        String partial = VoskJsonParser.parsePartial(json);
        if (partial.isEmpty() || partial.equals(lastPartial)) {
            return;
        }
        Instant now = clock.instant();
        if (lastInterimAt != null && Duration.between(lastInterimAt, now).compareTo(interimInterval) < 0) {
            return;
        }
        lastInterimAt = now;
        lastPartial = partial;
        Instant start = anchor.plus(bytesToDuration(utteranceStartBytes));
        events.add(new TranscriptEvent(speakerId, null, null, start, null, partial, null,
                false, "u" + utteranceIndex, sequence, SttEngineNames.VOSK, model));
    }

    private Instant offset(double seconds) {
        return anchor.plusMillis(Math.round(seconds * 1000.0));
    }

    private Duration bytesToDuration(long bytes) {
        return Duration.ofMillis(bytes * 1000L / bytesPerSecond);
    }

    // @GuardedBy("lock")
    private void closeRecognizer() {
        try {
            recognizer.close();
        } catch (RuntimeException e) {
            LOG.warn("Error closing recogniser for speaker {}", speakerId, e);
        }
    }

    private void deliver(List<TranscriptEvent> events) {
        for (TranscriptEvent event : events) {
            try {
                listener.onTranscript(event);
            } catch (RuntimeException e) {
                LOG.warn("Transcript listener failed for speaker {}", speakerId, e);
            }
        }
    }
}
