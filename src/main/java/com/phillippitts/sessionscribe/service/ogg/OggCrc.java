package com.phillippitts.sessionscribe.service.ogg;

/**
 * CRC-32 variant used by Ogg pages: polynomial {@code 0x04C11DB7}, MSB-first (non-reflected),
 * initial value 0, no final XOR. This differs from {@link java.util.zip.CRC32}.
 */
public final class OggCrc {

    private static final int POLYNOMIAL = 0x04C11DB7;
    private static final int[] TABLE = new int[256];

    static {
        for (int i = 0; i < 256; i++) {
            int r = i << 24;
            for (int bit = 0; bit < 8; bit++) {
                r = (r & 0x80000000) != 0 ? (r << 1) ^ POLYNOMIAL : r << 1;
            }
            TABLE[i] = r;
        }
    }

    private OggCrc() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes the checksum of a complete page. The checksum field (bytes 22..25) must already be zero.
     */
    public static int checksum(byte[] page) {
        return update(0, page, 0, page.length);
    }

    public static int update(int crc, byte[] data, int offset, int length) {
        int c = crc;
        for (int i = offset; i < offset + length; i++) {
            c = (c << 8) ^ TABLE[((c >>> 24) ^ (data[i] & 0xFF)) & 0xFF];
        }
        return c;
    }
}
