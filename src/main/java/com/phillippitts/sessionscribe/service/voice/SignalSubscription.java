package com.phillippitts.sessionscribe.service.voice;

/**
 * Revocable registration on a {@link SpeakingSignalSource}.
 *
 * <p>Closing removes exactly this registration. Other listeners on the same source are unaffected.
 */
public interface SignalSubscription extends AutoCloseable {

    boolean isActive();

    /**
     * Removes the registration. Idempotent.
     */
    @Override
    void close();
}
