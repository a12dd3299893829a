package com.phillippitts.sessionscribe.service.voice;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * Fan-out of speaking-start/speaking-end edges to any number of listeners.
 *
 * <p>The burst tracker and the STT orchestrator both listen to the same source. Each gets its own
 * {@link SignalSubscription}; tearing one down never removes the other.
 *
 * <p>A listener that throws is logged and skipped; delivery to the remaining listeners continues.
 */
public class SpeakingSignalSource {

    private static final Logger LOG = LogManager.getLogger(SpeakingSignalSource.class);

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    public SignalSubscription subscribe(SpeakingListener listener) {
        Registration registration = new Registration(Objects.requireNonNull(listener, "listener"));
        registrations.add(registration);
        return registration;
    }

    public void speakingStarted(String speakerId) {
        dispatch(speakerId, SpeakingListener::onSpeakingStart, "start");
    }

    public void speakingEnded(String speakerId) {
        dispatch(speakerId, SpeakingListener::onSpeakingEnd, "end");
    }

    public int listenerCount() {
        return registrations.size();
    }

    private void dispatch(String speakerId, BiConsumer<SpeakingListener, String> edge, String edgeName) {
        for (Registration registration : registrations) {
            if (!registration.isActive()) {
                continue;
            }
            try {
                edge.accept(registration.listener, speakerId);
            } catch (RuntimeException e) {
                LOG.warn("Speaking-{} listener {} failed for speaker {}",
                        edgeName, registration.listener.getClass().getSimpleName(), speakerId, e);
            }
        }
    }

    private final class Registration implements SignalSubscription {
        private final SpeakingListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(SpeakingListener listener) {
            this.listener = listener;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                registrations.remove(this);
            }
        }
    }
}
