package com.phillippitts.sessionscribe.service.recorder;

/**
 * Reads the duration of an Opus packet from its TOC byte (RFC 6716 section 3.1).
 *
 * <p>Only the header is inspected; nothing is decoded.
 */
public final class OpusPacketInspector {

    /** Duration every packet is assumed to have when frame offsets are computed. */
    public static final int STANDARD_PACKET_MICROS = 20_000;

    private static final int[] SILK_MICROS = {10_000, 20_000, 40_000, 60_000};
    private static final int[] CELT_MICROS = {2_500, 5_000, 10_000, 20_000};

    private OpusPacketInspector() {
        // Utility class - prevent instantiation
    }

    /**
     * Duration of one frame for the configuration encoded in {@code toc}.
     */
    public static int frameDurationMicros(byte toc) {
        int config = (toc >> 3) & 0x1F;
        if (config < 12) {
            return SILK_MICROS[config % 4];
        }
        if (config < 16) {
            return config % 2 == 0 ? 10_000 : 20_000;
        }
        return CELT_MICROS[(config - 16) % 4];
    }

    /**
     * Number of frames in the packet: code 0 carries one, codes 1 and 2 carry two, code 3 stores the
     * count in the low six bits of the second byte.
     *
     * @return frame count, or 0 if the packet is too short to tell
     */
    public static int frameCount(byte[] packet) {
        if (packet.length == 0) {
            return 0;
        }
        int code = packet[0] & 0x03;
        if (code == 0) {
            return 1;
        }
        if (code == 1 || code == 2) {
            return 2;
        }
        return packet.length < 2 ? 0 : packet[1] & 0x3F;
    }

    /**
     * Total audio duration carried by the packet, or 0 when it cannot be determined.
     */
    public static int packetDurationMicros(byte[] packet) {
        if (packet.length == 0) {
            return 0;
        }
        return frameDurationMicros(packet[0]) * frameCount(packet);
    }

    public static boolean isStandardDuration(byte[] packet) {
        return packetDurationMicros(packet) == STANDARD_PACKET_MICROS;
    }
}
