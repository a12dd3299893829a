package com.phillippitts.sessionscribe.service.ogg;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Streaming Ogg/Opus muxer that writes one Opus packet per Ogg page.
 *
 * <p>The two header pages ({@code OpusHead}, {@code OpusTags}) are written by the constructor.
 * Every page is flushed to the sink as soon as it is built, so a process crash leaves a file
 * that is readable up to the last complete page.
 *
 * <p><b>Fixed stream profile:</b> 48 kHz, stereo, 20 ms packets (960 samples), pre-skip 3840,
 * channel mapping family 0. The granule position therefore advances by exactly 960 per packet
 * regardless of the packet's actual TOC configuration.
 *
 * <p><b>Lifecycle:</b> {@link #finish()} appends an empty end-of-stream page and makes the muxer
 * inert; later {@link #writeFrame(byte[])} calls are dropped. The sink itself is owned by the caller.
 *
 * <p><b>Thread Safety:</b> All public methods are synchronized.
 */
public class OggOpusMuxer {

    public static final int SAMPLE_RATE = 48_000;
    public static final int CHANNELS = 2;
    public static final int PRE_SKIP = 3840;
    public static final int SAMPLES_PER_FRAME = 960;

    static final byte[] CAPTURE_PATTERN = {'O', 'g', 'g', 'S'};
    static final int HEADER_SIZE = 27;
    static final int CRC_OFFSET = 22;
    private static final int MAX_SEGMENTS = 255;
    private static final int LACE = 255;

    private final OutputStream sink;
    private final int serialNumber;
    private long granulePosition;
    private int pageSequence;
    private long framesWritten;
    private boolean finished;

    public OggOpusMuxer(OutputStream sink, String vendor) throws IOException {
        this(sink, vendor, ThreadLocalRandom.current().nextInt());
    }

    OggOpusMuxer(OutputStream sink, String vendor, int serialNumber) throws IOException {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.serialNumber = serialNumber;
        writePage(opusHead(), OggPage.FLAG_BOS);
        writePage(opusTags(Objects.requireNonNull(vendor, "vendor")), 0);
    }

    /**
     * Writes one encoded Opus packet as its own page. Dropped silently after {@link #finish()}.
     *
     * @throws IOException if the sink rejects the write
     * @throws IllegalArgumentException if the packet does not fit in a single page
     */
    public synchronized void writeFrame(byte[] packet) throws IOException {
        if (finished) {
            return;
        }
        Objects.requireNonNull(packet, "packet");
        requireFitsInPage(packet.length);
        granulePosition += SAMPLES_PER_FRAME;
        writePage(packet, 0);
        framesWritten++;
    }

    /**
     * Writes the end-of-stream page. Idempotent.
     */
    public synchronized void finish() throws IOException {
        if (finished) {
            return;
        }
        finished = true;
        writePage(new byte[0], OggPage.FLAG_EOS);
    }

    public synchronized boolean isFinished() {
        return finished;
    }

    public synchronized long getFramesWritten() {
        return framesWritten;
    }

    public synchronized long getGranulePosition() {
        return granulePosition;
    }

    public int getSerialNumber() {
        return serialNumber;
    }

    private static void requireFitsInPage(int length) {
        if (length / LACE + 1 > MAX_SEGMENTS) {
            throw new IllegalArgumentException("Packet of " + length + " bytes exceeds one page");
        }
    }

    private void writePage(byte[] payload, int headerType) throws IOException {
        int fullLaces = payload.length / LACE;
        // A trailing lace below 255 terminates the packet; a multiple of 255 needs an explicit 0
        int segments = fullLaces + 1;
        requireFitsInPage(payload.length);

        byte[] page = new byte[HEADER_SIZE + segments + payload.length];
        ByteBuffer buf = ByteBuffer.wrap(page).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(CAPTURE_PATTERN);
        buf.put((byte) 0); // stream structure version
        buf.put((byte) headerType);
        buf.putLong(granulePosition);
        buf.putInt(serialNumber);
        buf.putInt(pageSequence++);
        buf.putInt(0); // checksum placeholder
        buf.put((byte) segments);
        for (int i = 0; i < fullLaces; i++) {
            buf.put((byte) LACE);
        }
        buf.put((byte) (payload.length % LACE));
        buf.put(payload);

        buf.putInt(CRC_OFFSET, OggCrc.checksum(page));
        sink.write(page);
        sink.flush();
    }

    private static byte[] opusHead() {
        ByteBuffer head = ByteBuffer.allocate(19).order(ByteOrder.LITTLE_ENDIAN);
        head.put("OpusHead".getBytes(StandardCharsets.US_ASCII));
        head.put((byte) 1); // version
        head.put((byte) CHANNELS);
        head.putShort((short) PRE_SKIP);
        head.putInt(SAMPLE_RATE);
        head.putShort((short) 0); // output gain
        head.put((byte) 0); // channel mapping family
        return head.array();
    }

    private static byte[] opusTags(String vendor) {
        byte[] vendorBytes = vendor.getBytes(StandardCharsets.UTF_8);
        ByteBuffer tags = ByteBuffer.allocate(8 + 4 + vendorBytes.length + 4).order(ByteOrder.LITTLE_ENDIAN);
        tags.put("OpusTags".getBytes(StandardCharsets.US_ASCII));
        tags.putInt(vendorBytes.length);
        tags.put(vendorBytes);
        tags.putInt(0); // user comment count
        return tags.array();
    }
}
