package com.phillippitts.sessionscribe.persistence;

import com.phillippitts.sessionscribe.domain.Burst;
import com.phillippitts.sessionscribe.domain.Participant;
import com.phillippitts.sessionscribe.domain.RecordingSession;
import com.phillippitts.sessionscribe.domain.SessionStatus;
import com.phillippitts.sessionscribe.domain.Track;
import com.phillippitts.sessionscribe.domain.TranscriptEvent;
import com.phillippitts.sessionscribe.domain.TranscriptRecord;
import com.phillippitts.sessionscribe.domain.UsageRecord;
import com.phillippitts.sessionscribe.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RecordingStore} backed by an append-only JSON-lines journal.
 *
 * <p>Every mutation is appended as one JSON object per line and flushed before it is applied to the
 * in-memory view, so the file is always at least as new as what callers have observed. Opening a
 * store replays the journal; a line that cannot be parsed (typically the last line after a crash)
 * is skipped with a warning.
 *
 * <p>The offline hydration tool opens the same file read-side from a separate process.
 *
 * <p><b>Thread Safety:</b> all operations synchronize on a single lock.
 */
public class JournalRecordingStore implements RecordingStore, Closeable {

    private static final Logger LOG = LogManager.getLogger(JournalRecordingStore.class);

    static final String SESSION_INSERT = "session.insert";
    static final String SESSION_END = "session.end";
    static final String PARTICIPANT_JOIN = "participant.join";
    static final String PARTICIPANT_LEAVE = "participant.leave";
    static final String TRACK_INSERT = "track.insert";
    static final String TRACK_FIRST_PACKET = "track.firstPacket";
    static final String TRACK_END = "track.end";
    static final String BURST_INSERT = "burst.insert";
    static final String BURST_CLOSE = "burst.close";
    static final String TRANSCRIPT_UPSERT = "transcript.upsert";
    static final String USAGE_UPSERT = "usage.upsert";

    private final Path journalPath;
    private final Object lock = new Object();

    // @GuardedBy("lock")
    private BufferedWriter writer;
    private long nextId = 1;
    private final Map<String, RecordingSession> sessions = new LinkedHashMap<>();
    private final Map<String, Map<String, Participant>> participants = new HashMap<>();
    private final Map<Long, Track> tracks = new LinkedHashMap<>();
    private final Map<Long, Burst> bursts = new LinkedHashMap<>();
    private final Map<String, TranscriptLog> transcripts = new HashMap<>();
    private final Map<UsageKey, UsageRecord> usage = new HashMap<>();

    public JournalRecordingStore(Path journalPath) {
        this.journalPath = Objects.requireNonNull(journalPath, "journalPath");
        replay();
    }

    public Path getJournalPath() {
        return journalPath;
    }

    // ---- sessions ------------------------------------------------------------------------------

    @Override
    public void insertSession(RecordingSession session) {
        JSONObject entry = entry(SESSION_INSERT)
                .put("id", session.id())
                .put("guildId", nullable(session.guildId()))
                .put("channelId", nullable(session.channelId()))
                .put("startedAt", session.startedAt().toString())
                .put("status", session.status().name());
        synchronized (lock) {
            append(entry);
        }
    }

    @Override
    public void endSession(String sessionId, Instant endedAt, SessionStatus status) {
        synchronized (lock) {
            if (!sessions.containsKey(sessionId)) {
                throw new PersistenceException("Unknown session: " + sessionId);
            }
            append(entry(SESSION_END)
                    .put("id", sessionId)
                    .put("endedAt", endedAt.toString())
                    .put("status", status.name()));
        }
    }

    @Override
    public Optional<RecordingSession> findSession(String sessionId) {
        synchronized (lock) {
            return Optional.ofNullable(sessions.get(sessionId));
        }
    }

    @Override
    public List<RecordingSession> findActiveSessions() {
        synchronized (lock) {
            return sessions.values().stream()
                    .filter(s -> s.status() == SessionStatus.ACTIVE)
                    .toList();
        }
    }

    @Override
    public int recoverStaleSessions(Instant at) {
        synchronized (lock) {
            List<RecordingSession> stale = findActiveSessions();
            for (RecordingSession session : stale) {
                append(entry(SESSION_END)
                        .put("id", session.id())
                        .put("endedAt", at.toString())
                        .put("status", SessionStatus.ERROR.name()));
            }
            return stale.size();
        }
    }

    // ---- participants --------------------------------------------------------------------------

    @Override
    public void insertParticipant(Participant participant) {
        JSONObject entry = entry(PARTICIPANT_JOIN)
                .put("sessionId", participant.sessionId())
                .put("speakerId", participant.speakerId())
                .put("displayName", nullable(participant.displayName()))
                .put("joinedAt", participant.joinedAt().toString());
        synchronized (lock) {
            append(entry);
        }
    }

    @Override
    public void markParticipantLeft(String sessionId, String speakerId, Instant leftAt) {
        synchronized (lock) {
            append(entry(PARTICIPANT_LEAVE)
                    .put("sessionId", sessionId)
                    .put("speakerId", speakerId)
                    .put("leftAt", leftAt.toString()));
        }
    }

    @Override
    public List<Participant> getParticipants(String sessionId) {
        synchronized (lock) {
            return List.copyOf(participants.getOrDefault(sessionId, Map.of()).values());
        }
    }

    // ---- tracks --------------------------------------------------------------------------------

    @Override
    public Track insertTrack(String sessionId, String speakerId, int trackNumber, String filePath, Instant createdAt) {
        synchronized (lock) {
            long id = nextId;
            append(entry(TRACK_INSERT)
                    .put("id", id)
                    .put("sessionId", sessionId)
                    .put("speakerId", speakerId)
                    .put("trackNumber", trackNumber)
                    .put("filePath", filePath)
                    .put("createdAt", createdAt.toString()));
            return tracks.get(id);
        }
    }

    @Override
    public int countTracks(String sessionId, String speakerId) {
        synchronized (lock) {
            return (int) tracks.values().stream()
                    .filter(t -> t.sessionId().equals(sessionId) && t.speakerId().equals(speakerId))
                    .count();
        }
    }

    @Override
    public void markFirstPacket(long trackId, Instant at) {
        synchronized (lock) {
            requireTrack(trackId);
            append(entry(TRACK_FIRST_PACKET).put("id", trackId).put("at", at.toString()));
        }
    }

    @Override
    public void endTrack(long trackId, Instant endedAt) {
        synchronized (lock) {
            requireTrack(trackId);
            append(entry(TRACK_END).put("id", trackId).put("at", endedAt.toString()));
        }
    }

    @Override
    public List<Track> getSessionTracks(String sessionId) {
        synchronized (lock) {
            return tracks.values().stream()
                    .filter(t -> t.sessionId().equals(sessionId))
                    .sorted(Comparator.comparing(Track::createdAt).thenComparingLong(Track::id))
                    .toList();
        }
    }

    // ---- bursts --------------------------------------------------------------------------------

    @Override
    public Burst insertBurst(long trackId, Instant startedAt, long startFrameOffset) {
        synchronized (lock) {
            requireTrack(trackId);
            long id = nextId;
            append(entry(BURST_INSERT)
                    .put("id", id)
                    .put("trackId", trackId)
                    .put("startedAt", startedAt.toString())
                    .put("startFrameOffset", startFrameOffset));
            return bursts.get(id);
        }
    }

    @Override
    public void closeBurst(long burstId, Instant endedAt, long endFrameOffset) {
        synchronized (lock) {
            if (!bursts.containsKey(burstId)) {
                throw new PersistenceException("Unknown burst: " + burstId);
            }
            append(entry(BURST_CLOSE)
                    .put("id", burstId)
                    .put("endedAt", endedAt.toString())
                    .put("endFrameOffset", endFrameOffset));
        }
    }

    @Override
    public List<Burst> getTrackBursts(long trackId) {
        synchronized (lock) {
            return bursts.values().stream()
                    .filter(b -> b.trackId() == trackId)
                    .sorted(Comparator.comparing(Burst::startedAt).thenComparingLong(Burst::id))
                    .toList();
        }
    }

    @Override
    public Optional<Burst> findBurstForTimestamp(long trackId, Instant at, Duration tolerance) {
        Instant upper = at.plus(tolerance);
        Instant lower = at.minus(tolerance);
        synchronized (lock) {
            return bursts.values().stream()
                    .filter(b -> b.trackId() == trackId)
                    .filter(b -> !b.startedAt().isAfter(upper))
                    .filter(b -> b.endedAt() == null || !b.endedAt().isBefore(lower))
                    .max(Comparator.comparing(Burst::startedAt));
        }
    }

    // ---- transcripts and usage -----------------------------------------------------------------

    @Override
    public void upsertTranscript(TranscriptRecord record) {
        synchronized (lock) {
            if (record.hasUpsertKey()) {
                TranscriptLog log = transcripts.get(record.sessionId());
                TranscriptRecord existing = log == null ? null : log.find(TranscriptKey.of(record));
                if (existing != null && existing.event().isFinal() && !record.event().isFinal()) {
                    return;
                }
            }
            append(transcriptEntry(record));
        }
    }

    @Override
    public List<TranscriptRecord> getTranscripts(String sessionId) {
        synchronized (lock) {
            TranscriptLog log = transcripts.get(sessionId);
            return log == null ? List.of() : List.copyOf(log.rows);
        }
    }

    @Override
    public void upsertUsage(UsageRecord record) {
        synchronized (lock) {
            append(entry(USAGE_UPSERT)
                    .put("sessionId", record.sessionId())
                    .put("engine", record.engine())
                    .put("speechSeconds", record.speechSeconds())
                    .put("estimatedCostUsd", record.estimatedCostUsd()));
        }
    }

    @Override
    public Optional<UsageRecord> getUsage(String sessionId, String engine) {
        synchronized (lock) {
            return Optional.ofNullable(usage.get(new UsageKey(sessionId, engine)));
        }
    }

    @Override
    public void close() throws IOException {
        synchronized (lock) {
            if (writer != null) {
                writer.close();
                writer = null;
            }
        }
    }

    // ---- journal mechanics ---------------------------------------------------------------------

    private void replay() {
        if (!Files.exists(journalPath)) {
            return;
        }
        int lineNumber = 0;
        int skipped = 0;
        synchronized (lock) {
            try (BufferedReader reader = Files.newBufferedReader(journalPath, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    try {
                        apply(new JSONObject(line));
                    } catch (JSONException | DateTimeParseException | IllegalArgumentException e) {
                        skipped++;
                        LOG.warn("Skipping unreadable journal line {} in {}: {}", lineNumber, journalPath, e.getMessage());
                    }
                }
            } catch (IOException e) {
                throw new PersistenceException("Failed to read journal " + journalPath, e);
            }
        }
        LOG.info("Replayed journal {}: {} lines, {} skipped, {} sessions", journalPath, lineNumber, skipped, sessions.size());
    }

    // @GuardedBy("lock")
    private void append(JSONObject entry) {
        try {
            if (writer == null) {
                Path parent = journalPath.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                writer = Files.newBufferedWriter(journalPath, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
            writer.write(entry.toString());
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new PersistenceException("Failed to append to journal " + journalPath, e);
        }
        apply(entry);
    }

    // @GuardedBy("lock")
    private void apply(JSONObject e) {
        String type = e.getString("type");
        switch (type) {
            case SESSION_INSERT -> sessions.put(e.getString("id"), new RecordingSession(
                    e.getString("id"), optString(e, "guildId"), optString(e, "channelId"),
                    Instant.parse(e.getString("startedAt")), null, SessionStatus.valueOf(e.getString("status"))));
            case SESSION_END -> sessions.computeIfPresent(e.getString("id"), (id, s) ->
                    s.withEnd(Instant.parse(e.getString("endedAt")), SessionStatus.valueOf(e.getString("status"))));
            case PARTICIPANT_JOIN -> participants
                    .computeIfAbsent(e.getString("sessionId"), k -> new LinkedHashMap<>())
                    .put(e.getString("speakerId"), new Participant(e.getString("sessionId"), e.getString("speakerId"),
                            optString(e, "displayName"), Instant.parse(e.getString("joinedAt")), null));
            case PARTICIPANT_LEAVE -> participants
                    .getOrDefault(e.getString("sessionId"), new HashMap<>())
                    .computeIfPresent(e.getString("speakerId"), (k, p) -> p.withLeftAt(Instant.parse(e.getString("leftAt"))));
            case TRACK_INSERT -> {
                long id = e.getLong("id");
                tracks.put(id, new Track(id, e.getString("sessionId"), e.getString("speakerId"), e.getInt("trackNumber"),
                        e.getString("filePath"), Instant.parse(e.getString("createdAt")), null, null));
                nextId = Math.max(nextId, id + 1);
            }
            case TRACK_FIRST_PACKET -> tracks.computeIfPresent(e.getLong("id"),
                    (id, t) -> t.withFirstPacketAt(Instant.parse(e.getString("at"))));
            case TRACK_END -> tracks.computeIfPresent(e.getLong("id"),
                    (id, t) -> t.withEndedAt(Instant.parse(e.getString("at"))));
            case BURST_INSERT -> {
                long id = e.getLong("id");
                bursts.put(id, new Burst(id, e.getLong("trackId"), Instant.parse(e.getString("startedAt")), null,
                        e.getLong("startFrameOffset"), null));
                nextId = Math.max(nextId, id + 1);
            }
            case BURST_CLOSE -> bursts.computeIfPresent(e.getLong("id"),
                    (id, b) -> b.closedAt(Instant.parse(e.getString("endedAt")), e.getLong("endFrameOffset")));
            case TRANSCRIPT_UPSERT -> applyTranscript(parseTranscript(e));
            case USAGE_UPSERT -> {
                UsageRecord record = new UsageRecord(e.getString("sessionId"), e.getString("engine"),
                        e.getDouble("speechSeconds"), e.getDouble("estimatedCostUsd"));
                usage.put(new UsageKey(record.sessionId(), record.engine()), record);
            }
            default -> LOG.warn("Ignoring unknown journal entry type '{}'", type);
        }
    }

    // @GuardedBy("lock")
    private void applyTranscript(TranscriptRecord record) {
        TranscriptLog log = transcripts.computeIfAbsent(record.sessionId(), k -> new TranscriptLog());
        if (!record.hasUpsertKey()) {
            log.rows.add(record);
            return;
        }
        TranscriptKey key = TranscriptKey.of(record);
        Integer index = log.index.get(key);
        if (index == null) {
            log.index.put(key, log.rows.size());
            log.rows.add(record);
            return;
        }
        TranscriptRecord existing = log.rows.get(index);
        if (existing.event().isFinal() && !record.event().isFinal()) {
            return;
        }
        Long burstId = record.burstId() != null ? record.burstId() : existing.burstId();
        log.rows.set(index, new TranscriptRecord(record.sessionId(), record.trackId(), burstId,
                record.displayName(), record.event()));
    }

    private static JSONObject transcriptEntry(TranscriptRecord r) {
        TranscriptEvent ev = r.event();
        return entry(TRANSCRIPT_UPSERT)
                .put("sessionId", r.sessionId())
                .put("trackId", nullable(r.trackId()))
                .put("burstId", nullable(r.burstId()))
                .put("displayName", nullable(r.displayName()))
                .put("speakerId", ev.speakerId())
                .put("speakerLabel", nullable(ev.speakerLabel()))
                .put("segmentStart", ev.segmentStart().toString())
                .put("segmentEnd", nullable(ev.segmentEnd() == null ? null : ev.segmentEnd().toString()))
                .put("text", ev.text())
                .put("confidence", nullable(ev.confidence()))
                .put("isFinal", ev.isFinal())
                .put("resultId", nullable(ev.resultId()))
                .put("streamSequence", ev.streamSequence())
                .put("engine", nullable(ev.engine()))
                .put("model", nullable(ev.model()));
    }

    private static TranscriptRecord parseTranscript(JSONObject e) {
        String segmentEnd = optString(e, "segmentEnd");
        TranscriptEvent event = new TranscriptEvent(
                e.getString("speakerId"),
                null,
                optString(e, "speakerLabel"),
                Instant.parse(e.getString("segmentStart")),
                segmentEnd == null ? null : Instant.parse(segmentEnd),
                e.getString("text"),
                e.isNull("confidence") ? null : e.getDouble("confidence"),
                e.getBoolean("isFinal"),
                optString(e, "resultId"),
                e.getInt("streamSequence"),
                optString(e, "engine"),
                optString(e, "model"));
        return new TranscriptRecord(e.getString("sessionId"),
                e.isNull("trackId") ? null : e.getLong("trackId"),
                e.isNull("burstId") ? null : e.getLong("burstId"),
                optString(e, "displayName"),
                event);
    }

    private void requireTrack(long trackId) {
        if (!tracks.containsKey(trackId)) {
            throw new PersistenceException("Unknown track: " + trackId);
        }
    }

    private static JSONObject entry(String type) {
        return new JSONObject().put("type", type);
    }

    private static Object nullable(Object value) {
        return value == null ? JSONObject.NULL : value;
    }

    private static String optString(JSONObject e, String key) {
        return e.isNull(key) ? null : e.getString(key);
    }

    private record TranscriptKey(String sessionId, Long trackId, String speakerId, int sequence, String resultId) {
        static TranscriptKey of(TranscriptRecord r) {
            return new TranscriptKey(r.sessionId(), r.trackId(), r.event().speakerId(),
                    r.event().streamSequence(), r.event().resultId());
        }
    }

    private record UsageKey(String sessionId, String engine) {
    }

    private static final class TranscriptLog {
        private final List<TranscriptRecord> rows = new ArrayList<>();
        private final Map<TranscriptKey, Integer> index = new HashMap<>();

        TranscriptRecord find(TranscriptKey key) {
            Integer i = index.get(key);
            return i == null ? null : rows.get(i);
        }
    }
}
