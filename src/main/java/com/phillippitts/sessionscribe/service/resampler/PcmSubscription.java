package com.phillippitts.sessionscribe.service.resampler;

/**
 * Handle returned by {@link ResamplerProcess#addPcmListener(PcmListener)}. Closing is idempotent.
 */
@FunctionalInterface
public interface PcmSubscription extends AutoCloseable {

    @Override
    void close();
}
