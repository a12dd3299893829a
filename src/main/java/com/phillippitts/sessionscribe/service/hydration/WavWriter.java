package com.phillippitts.sessionscribe.service.hydration;

import com.phillippitts.sessionscribe.exception.HydrationException;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Wraps a raw PCM file in a canonical 44-byte RIFF/WAVE header.
 *
 * <p>Format is fixed to {@link PcmFormat}. The data is streamed from the raw file, so arbitrarily
 * long tracks never sit in memory.
 */
public final class WavWriter {

    static final int HEADER_SIZE = 44;
    private static final long MAX_DATA_SIZE = 0xFFFF_FFFFL - 36;

    private WavWriter() {
    }

    /**
     * Writes {@code wavPath} containing the bytes of {@code rawPcm}.
     *
     * @throws HydrationException if the raw file cannot be read, the output cannot be written, or the
     *                            data exceeds the 4 GiB RIFF limit
     */
    public static void wrapRawPcm(Path rawPcm, Path wavPath) {
        Objects.requireNonNull(rawPcm, "rawPcm must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try {
            long dataSize = Files.size(rawPcm);
            if (dataSize > MAX_DATA_SIZE) {
                throw new HydrationException("PCM data too large for WAV (" + dataSize + " bytes): " + rawPcm);
            }
            try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(wavPath))) {
                writeHeader(os, dataSize);
                Files.copy(rawPcm, os);
                os.flush();
            }
        } catch (IOException e) {
            throw new HydrationException("Failed to write WAV file to " + wavPath + ": " + e.getMessage(), e);
        }
    }

    static void writeHeader(OutputStream os, long dataSize) throws IOException {
        // RIFF chunk
        os.write(new byte[] { 'R', 'I', 'F', 'F' });
        writeLEInt(os, 36 + dataSize);
        os.write(new byte[] { 'W', 'A', 'V', 'E' });

        // fmt chunk: PCM, 16 bytes
        os.write(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(os, 16);
        writeLEShort(os, 1);
        writeLEShort(os, PcmFormat.CHANNELS);
        writeLEInt(os, PcmFormat.SAMPLE_RATE);
        writeLEInt(os, PcmFormat.BYTES_PER_SECOND);
        writeLEShort(os, PcmFormat.CHANNELS * PcmFormat.BYTES_PER_SAMPLE);
        writeLEShort(os, PcmFormat.BITS_PER_SAMPLE);

        // data chunk
        os.write(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, dataSize);
    }

    private static void writeLEShort(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, long v) throws IOException {
        os.write((int) (v & 0xFF));
        os.write((int) ((v >>> 8) & 0xFF));
        os.write((int) ((v >>> 16) & 0xFF));
        os.write((int) ((v >>> 24) & 0xFF));
    }
}
