package com.phillippitts.sessionscribe.service.ogg;

/**
 * One parsed Ogg page.
 *
 * @param headerType flag byte ({@link #FLAG_CONTINUED}, {@link #FLAG_BOS}, {@link #FLAG_EOS})
 * @param granulePosition absolute sample position at the end of the page
 * @param serialNumber logical stream serial
 * @param sequenceNumber page counter within the logical stream
 * @param lacing segment table, one value per segment (0..255)
 * @param payload concatenated segment data
 */
public record OggPage(int headerType, long granulePosition, int serialNumber, int sequenceNumber,
                      int[] lacing, byte[] payload) {

    public static final int FLAG_CONTINUED = 0x01;
    public static final int FLAG_BOS = 0x02;
    public static final int FLAG_EOS = 0x04;

    public boolean isBeginningOfStream() {
        return (headerType & FLAG_BOS) != 0;
    }

    public boolean isEndOfStream() {
        return (headerType & FLAG_EOS) != 0;
    }

    public boolean isContinued() {
        return (headerType & FLAG_CONTINUED) != 0;
    }
}
