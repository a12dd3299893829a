package com.phillippitts.sessionscribe.service.resampler;

/**
 * Receives 16-bit little-endian mono PCM chunks from a resampler. Chunks always hold whole samples.
 */
@FunctionalInterface
public interface PcmListener {

    void onPcm(byte[] pcm);
}
