package com.phillippitts.sessionscribe.service.ogg;

import com.phillippitts.sessionscribe.exception.ContainerFormatException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads Ogg pages and reassembles the packets they carry.
 *
 * <p>Reading stops quietly at the first incomplete page, which is what a file cut short by a crash
 * looks like. A page that is complete but fails its capture-pattern or CRC check raises
 * {@link ContainerFormatException}.
 */
public final class OggPageReader {

    private static final int OPUS_HEADER_PACKETS = 2;

    private OggPageReader() {
        // Utility class - prevent instantiation
    }

    public static List<OggPage> readPages(InputStream in) throws IOException {
        List<OggPage> pages = new ArrayList<>();
        long offset = 0;
        while (true) {
            byte[] header = in.readNBytes(OggOpusMuxer.HEADER_SIZE);
            if (header.length < OggOpusMuxer.HEADER_SIZE) {
                break;
            }
            if (!Arrays.equals(header, 0, 4, OggOpusMuxer.CAPTURE_PATTERN, 0, 4)) {
                throw new ContainerFormatException("Missing OggS capture pattern", offset);
            }
            int segments = header[26] & 0xFF;
            byte[] table = in.readNBytes(segments);
            if (table.length < segments) {
                break;
            }
            int[] lacing = new int[segments];
            int payloadLength = 0;
            for (int i = 0; i < segments; i++) {
                lacing[i] = table[i] & 0xFF;
                payloadLength += lacing[i];
            }
            byte[] payload = in.readNBytes(payloadLength);
            if (payload.length < payloadLength) {
                break;
            }

            ByteBuffer hb = ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN);
            int storedCrc = hb.getInt(OggOpusMuxer.CRC_OFFSET);
            hb.putInt(OggOpusMuxer.CRC_OFFSET, 0);
            int crc = OggCrc.update(0, header, 0, header.length);
            crc = OggCrc.update(crc, table, 0, table.length);
            crc = OggCrc.update(crc, payload, 0, payload.length);
            if (crc != storedCrc) {
                throw new ContainerFormatException("Page checksum mismatch", offset);
            }

            pages.add(new OggPage(header[5] & 0xFF, hb.getLong(6), hb.getInt(14), hb.getInt(18), lacing, payload));
            offset += header.length + table.length + payload.length;
        }
        return pages;
    }

    /**
     * Reassembles every complete packet in page order, header packets included.
     * A packet still open when the data runs out is discarded.
     */
    public static List<byte[]> readPackets(InputStream in) throws IOException {
        List<byte[]> packets = new ArrayList<>();
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        for (OggPage page : readPages(in)) {
            int pos = 0;
            for (int lace : page.lacing()) {
                pending.write(page.payload(), pos, lace);
                pos += lace;
                if (lace < 255) {
                    packets.add(pending.toByteArray());
                    pending.reset();
                }
            }
        }
        return packets;
    }

    /**
     * Returns the audio packets of an Ogg/Opus stream, skipping {@code OpusHead} and {@code OpusTags}
     * and the empty packet of the end-of-stream page.
     */
    public static List<byte[]> readAudioPackets(InputStream in) throws IOException {
        List<byte[]> packets = readPackets(in);
        if (packets.isEmpty()) {
            return packets;
        }
        if (!startsWith(packets.get(0), "OpusHead")) {
            throw new ContainerFormatException("First packet is not OpusHead", 0);
        }
        List<byte[]> audio = new ArrayList<>();
        for (int i = OPUS_HEADER_PACKETS; i < packets.size(); i++) {
            if (packets.get(i).length > 0) {
                audio.add(packets.get(i));
            }
        }
        return audio;
    }

    private static boolean startsWith(byte[] packet, String magic) {
        if (packet.length < magic.length()) {
            return false;
        }
        for (int i = 0; i < magic.length(); i++) {
            if (packet[i] != magic.charAt(i)) {
                return false;
            }
        }
        return true;
    }
}
