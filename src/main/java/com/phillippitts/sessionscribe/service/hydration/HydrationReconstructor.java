package com.phillippitts.sessionscribe.service.hydration;

import com.phillippitts.sessionscribe.domain.Burst;
import com.phillippitts.sessionscribe.domain.Track;
import com.phillippitts.sessionscribe.exception.ContainerFormatException;
import com.phillippitts.sessionscribe.exception.HydrationException;
import com.phillippitts.sessionscribe.persistence.RecordingStore;
import com.phillippitts.sessionscribe.service.ogg.OggOpusMuxer;
import com.phillippitts.sessionscribe.service.ogg.OggPageReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rebuilds time-aligned audio from speech-only track recordings.
 *
 * <p>Each burst is placed at its wall-clock offset from the track's first packet:
 * {@code silence = alignDown((burstStart - firstPacketAt) x bytesPerSecond) - bytesWrittenSoFar}.
 * Anchoring every burst on the first packet, rather than adding gaps between bursts, keeps frames
 * lost earlier in the track from shifting everything after them.
 *
 * <p>Single gaps are capped at {@code maxSilence} unless clamping is disabled. Burst frame offsets
 * beyond the decoded audio are warned about and clamped; a burst starting past the end is skipped.
 */
public class HydrationReconstructor {

    private static final Logger LOG = LogManager.getLogger(HydrationReconstructor.class);

    static final String OUTPUT_DIR = "hydrated";
    static final String MIX_FILE = "session_mix.wav";

    private static final int PRE_SKIP_FRAMES = OggOpusMuxer.PRE_SKIP / OggOpusMuxer.SAMPLES_PER_FRAME;

    private final RecordingStore store;
    private final AudioToolchain tools;
    private final Path dataDir;
    private final Duration maxSilence;

    public HydrationReconstructor(RecordingStore store, AudioToolchain tools, Path dataDir, Duration maxSilence) {
        this.store = Objects.requireNonNull(store, "store");
        this.tools = Objects.requireNonNull(tools, "tools");
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
        this.maxSilence = Objects.requireNonNull(maxSilence, "maxSilence");
    }

    /**
     * Hydrates every track of the session into {@code {dataDir}/{sessionId}/hydrated/}.
     *
     * @param mix   also produce {@value #MIX_FILE}
     * @param clamp cap single silence gaps at the configured maximum
     * @throws HydrationException if the session or its tracks are missing or nothing could be hydrated
     */
    public HydrationReport hydrate(String sessionId, boolean mix, boolean clamp) {
        if (store.findSession(sessionId).isEmpty()) {
            throw new HydrationException("Session not found: " + sessionId);
        }
        List<Track> tracks = store.getSessionTracks(sessionId);
        if (tracks.isEmpty()) {
            throw new HydrationException("No audio tracks found for session " + sessionId);
        }
        Path outputDir = dataDir.resolve(sessionId).resolve(OUTPUT_DIR);
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new HydrationException("Cannot create output directory " + outputDir, e);
        }
        LOG.info("Hydrating session {}: {} track(s) into {}", sessionId, tracks.size(), outputDir);
        if (!clamp) {
            LOG.info("Silence gaps will not be capped; output files may be very large");
        }

        List<TrackHydration> results = new ArrayList<>();
        for (Track track : tracks) {
            hydrateTrack(track, outputDir, clamp).ifPresent(results::add);
        }
        if (results.isEmpty()) {
            throw new HydrationException("No tracks were hydrated (no bursts or missing files)");
        }

        Path mixFile = null;
        if (mix) {
            mixFile = outputDir.resolve(MIX_FILE);
            LOG.info("Mixing {} track(s) into {}", results.size(), mixFile.getFileName());
            tools.mix(results.stream().map(TrackHydration::output).toList(), mixFile);
        }
        return new HydrationReport(sessionId, outputDir, List.copyOf(results), mixFile);
    }

    Optional<TrackHydration> hydrateTrack(Track track, Path outputDir, boolean clamp) {
        List<Burst> bursts = store.getTrackBursts(track.id());
        if (bursts.isEmpty()) {
            LOG.warn("Track {} (speaker {}): no bursts, skipping", track.id(), track.speakerId());
            return Optional.empty();
        }
        if (track.firstPacketAt() == null) {
            LOG.warn("Track {} (speaker {}): no first packet time, skipping", track.id(), track.speakerId());
            return Optional.empty();
        }
        Path input = Path.of(track.filePath()).toAbsolutePath();
        if (!Files.exists(input)) {
            LOG.error("Track {}: file not found: {}", track.id(), input);
            return Optional.empty();
        }

        String baseName = baseName(input);
        Path output = outputDir.resolve(baseName + ".wav");
        Path decoded = outputDir.resolve(baseName + ".wav.pcm");
        Path assembled = outputDir.resolve(baseName + ".wav.hydrated.pcm");
        try {
            LOG.info("Track {} (speaker {}): decoding", track.id(), track.speakerId());
            tools.decodeToPcm(input, decoded);
            long decodedBytes = Files.size(decoded);
            long decodedFrames = decodedBytes / PcmFormat.BYTES_PER_FRAME;
            LOG.info("Track {}: decoded {} frames ({}s of speech)", track.id(), decodedFrames,
                    String.format("%.1f", decodedBytes / (double) PcmFormat.BYTES_PER_SECOND));
            checkPacketCount(track, input, decodedFrames);

            Assembly assembly;
            try (FileChannel source = FileChannel.open(decoded, StandardOpenOption.READ);
                 OutputStream out = new BufferedOutputStream(Files.newOutputStream(assembled))) {
                assembly = assemble(track, bursts, source, decodedBytes, out, clamp);
            }
            WavWriter.wrapRawPcm(assembled, output);
            TrackHydration result = new TrackHydration(track.id(), track.speakerId(), output,
                    assembly.bursts(), assembly.bytes());
            LOG.info("Track {}: {} burst(s), {}s total -> {}", track.id(), assembly.bursts(),
                    String.format("%.1f", assembly.bytes() / (double) PcmFormat.BYTES_PER_SECOND),
                    output.getFileName());
            return Optional.of(result);
        } catch (IOException e) {
            throw new HydrationException("I/O error hydrating track " + track.id(), e);
        } finally {
            deleteQuietly(decoded);
            deleteQuietly(assembled);
        }
    }

    /**
     * Writes silence and burst spans for one track.
     */
    Assembly assemble(Track track,
                      List<Burst> bursts,
                      FileChannel decoded,
                      long decodedBytes,
                      OutputStream out,
                      boolean clamp) throws IOException {
        long decodedFrames = decodedBytes / PcmFormat.BYTES_PER_FRAME;
        long maxSilenceBytes = maxSilence.toSeconds() * PcmFormat.BYTES_PER_SECOND;
        Instant firstPacketAt = track.firstPacketAt();
        long written = 0;
        int burstsWritten = 0;

        List<Burst> ordered = new ArrayList<>(bursts);
        ordered.sort(Comparator.comparing(Burst::startedAt).thenComparingLong(Burst::id));
        for (Burst burst : ordered) {
            long targetBytes = Duration.between(firstPacketAt, burst.startedAt()).toMillis()
                    * PcmFormat.BYTES_PER_SECOND / 1000;
            long silence = PcmFormat.alignDownToFrame(targetBytes) - written;
            if (clamp && silence > maxSilenceBytes) {
                LOG.warn("Burst {}: silence gap {}s exceeds {}s cap; clamping", burst.id(),
                        String.format("%.1f", silence / (double) PcmFormat.BYTES_PER_SECOND), maxSilence.toSeconds());
                silence = maxSilenceBytes;
            }
            if (silence > 0) {
                writeSilence(out, silence);
                written += silence;
            }

            long endFrame = burst.endFrameOffset() != null ? burst.endFrameOffset() : decodedFrames;
            if (endFrame > decodedFrames) {
                LOG.warn("Burst {}: end frame {} exceeds decoded frames {}; possible tracking drift",
                        burst.id(), endFrame, decodedFrames);
            }
            if (burst.startFrameOffset() > decodedFrames) {
                LOG.warn("Burst {}: start frame {} exceeds decoded frames {}; skipping",
                        burst.id(), burst.startFrameOffset(), decodedFrames);
                continue;
            }
            long start = Math.min(burst.startFrameOffset() * PcmFormat.BYTES_PER_FRAME, decodedBytes);
            long end = Math.min(endFrame * PcmFormat.BYTES_PER_FRAME, decodedBytes);
            if (start < end) {
                copyRange(decoded, start, end, out);
                written += end - start;
                burstsWritten++;
            }
        }
        out.flush();
        return new Assembly(burstsWritten, written);
    }

    private void checkPacketCount(Track track, Path input, long decodedFrames) {
        try (InputStream in = Files.newInputStream(input)) {
            int packets = OggPageReader.readAudioPackets(in).size();
            if (Math.abs(packets - decodedFrames) > PRE_SKIP_FRAMES) {
                LOG.warn("Track {}: {} packets in container but {} decoded frames; offsets may drift",
                        track.id(), packets, decodedFrames);
            }
        } catch (ContainerFormatException e) {
            LOG.warn("Track {}: container damaged at offset {}; relying on decoder output",
                    track.id(), e.getOffset());
        } catch (IOException e) {
            LOG.warn("Track {}: could not count packets: {}", track.id(), e.toString());
        }
    }

    private static void writeSilence(OutputStream out, long bytes) throws IOException {
        byte[] chunk = new byte[(int) Math.min(bytes, PcmFormat.SILENCE_CHUNK_SIZE)];
        long remaining = bytes;
        while (remaining > 0) {
            int n = (int) Math.min(remaining, chunk.length);
            out.write(chunk, 0, n);
            remaining -= n;
        }
    }

    private static void copyRange(FileChannel source, long start, long end, OutputStream out) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(PcmFormat.SILENCE_CHUNK_SIZE);
        long position = start;
        while (position < end) {
            buffer.clear();
            buffer.limit((int) Math.min(buffer.capacity(), end - position));
            int read = source.read(buffer, position);
            if (read < 0) {
                throw new IOException("Unexpected end of decoded audio at byte " + position);
            }
            out.write(buffer.array(), 0, read);
            position += read;
        }
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".ogg") ? name.substring(0, name.length() - 4) : name;
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not delete temporary file {}: {}", file, e.toString());
        }
    }

    record Assembly(int bursts, long bytes) {
    }
}
