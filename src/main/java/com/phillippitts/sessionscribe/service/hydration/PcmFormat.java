package com.phillippitts.sessionscribe.service.hydration;

import com.phillippitts.sessionscribe.service.ogg.OggOpusMuxer;

/**
 * Raw PCM layout produced when decoding a recorded track: 48 kHz, stereo, 16-bit signed little-endian.
 */
public final class PcmFormat {

    public static final int SAMPLE_RATE = OggOpusMuxer.SAMPLE_RATE;
    public static final int CHANNELS = OggOpusMuxer.CHANNELS;
    public static final int BYTES_PER_SAMPLE = 2;
    public static final int BITS_PER_SAMPLE = BYTES_PER_SAMPLE * 8;

    /** One 20 ms frame: 960 samples x 2 channels x 2 bytes. */
    public static final int BYTES_PER_FRAME = OggOpusMuxer.SAMPLES_PER_FRAME * CHANNELS * BYTES_PER_SAMPLE;

    public static final int BYTES_PER_SECOND = SAMPLE_RATE * CHANNELS * BYTES_PER_SAMPLE;

    /** Silence is streamed in chunks of this size. */
    public static final int SILENCE_CHUNK_SIZE = 65_536;

    private PcmFormat() {
        // Utility class - prevent instantiation
    }

    public static long alignDownToFrame(long bytes) {
        return bytes - Math.floorMod(bytes, (long) BYTES_PER_FRAME);
    }
}
