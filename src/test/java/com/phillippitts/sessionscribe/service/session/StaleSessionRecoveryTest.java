package com.phillippitts.sessionscribe.service.session;

import com.phillippitts.sessionscribe.domain.RecordingSession;
import com.phillippitts.sessionscribe.domain.SessionStatus;
import com.phillippitts.sessionscribe.persistence.JournalRecordingStore;
import com.phillippitts.sessionscribe.testutil.ManualTaskScheduler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class StaleSessionRecoveryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T20:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void shouldMarkSessionsLeftActiveAsError() throws IOException {
        // Arrange
        Path journal = tempDir.resolve("journal.jsonl");
        try (JournalRecordingStore previousRun = new JournalRecordingStore(journal)) {
            previousRun.insertSession(new RecordingSession("crashed", "g1", "c1", T0, null, SessionStatus.ACTIVE));
            previousRun.insertSession(new RecordingSession("clean", "g2", "c2", T0, null, SessionStatus.ACTIVE));
            previousRun.endSession("clean", T0.plusSeconds(60), SessionStatus.STOPPED);
        }
        ManualTaskScheduler scheduler = new ManualTaskScheduler(T0.plusSeconds(3600));

        try (JournalRecordingStore store = new JournalRecordingStore(journal)) {
            // Act
            new StaleSessionRecovery(store, scheduler).recover();

            // Assert
            RecordingSession crashed = store.findSession("crashed").orElseThrow();
            assertThat(crashed.status()).isEqualTo(SessionStatus.ERROR);
            assertThat(crashed.endedAt()).isEqualTo(T0.plusSeconds(3600));
            assertThat(store.findSession("clean").orElseThrow().status()).isEqualTo(SessionStatus.STOPPED);
            assertThat(store.findActiveSessions()).isEmpty();
        }
    }
}
