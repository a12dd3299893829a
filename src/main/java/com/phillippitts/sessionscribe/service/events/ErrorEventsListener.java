package com.phillippitts.sessionscribe.service.events;

import com.phillippitts.sessionscribe.service.recorder.NonStandardFrameEvent;
import com.phillippitts.sessionscribe.service.resampler.ResamplerFailureEvent;
import com.phillippitts.sessionscribe.service.stt.SttStreamFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central handler for pipeline failure events. Throttled per key to avoid log spam; never logs
 * transcript text. Handlers run on the {@code eventExecutor} pool so publishers never block on logging.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener(TaskScheduler scheduler) {
        this.clock = scheduler.getClock();
    }

    @Async("eventExecutor")
    @EventListener
    void onResamplerFailure(ResamplerFailureEvent e) {
        if (shouldLog("resampler-" + e.key())) {
            LOG.warn("Resampler failure for {}: {} (exit={}). Check resampler.ffmpeg-path and that ffmpeg "
                    + "supports Ogg/Opus input.", e.key(), e.reason(), e.exitCode());
        }
    }

    @Async("eventExecutor")
    @EventListener
    void onSttStreamFailure(SttStreamFailureEvent e) {
        if (shouldLog("stt-" + e.sessionId() + '-' + e.speakerId())) {
            LOG.warn("STT stream {} for speaker {} in session {} failed: {} (engine={})",
                    e.sequence(), e.speakerId(), e.sessionId(), e.reason(), e.engine());
        }
    }

    @Async("eventExecutor")
    @EventListener
    void onNonStandardFrame(NonStandardFrameEvent e) {
        if (shouldLog("frame-" + e.sessionId() + '-' + e.speakerId())) {
            LOG.warn("Track {} of speaker {} received a {}us packet at frame {}; burst offsets for this "
                    + "track assume 20ms frames", e.trackId(), e.speakerId(), e.durationMicros(), e.frameIndex());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
