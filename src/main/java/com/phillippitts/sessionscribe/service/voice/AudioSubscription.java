package com.phillippitts.sessionscribe.service.voice;

/**
 * Handle for one speaker's audio feed. Closing is idempotent.
 */
@FunctionalInterface
public interface AudioSubscription extends AutoCloseable {

    @Override
    void close();
}
