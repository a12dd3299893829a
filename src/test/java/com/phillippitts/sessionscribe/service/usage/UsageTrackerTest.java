package com.phillippitts.sessionscribe.service.usage;

import com.phillippitts.sessionscribe.domain.UsageRecord;
import com.phillippitts.sessionscribe.persistence.RecordingStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class UsageTrackerTest {

    private RecordingStore store;
    private SimpleMeterRegistry meterRegistry;
    private UsageTracker tracker;

    @BeforeEach
    void setUp() {
        store = mock(RecordingStore.class);
        meterRegistry = new SimpleMeterRegistry();
        tracker = new UsageTracker("s1", "vosk", store, 1.0, meterRegistry);
    }

    @Test
    void shouldPriceMinutesWithOverhead() {
        // One minute: 0.024 x 1.2
        assertThat(UsageTracker.costFor(60_000)).isCloseTo(0.0288, within(1e-9));
        assertThat(UsageTracker.costFor(0)).isZero();
    }

    @Test
    void shouldAccumulateSpeechAndIgnoreNonPositiveDurations() {
        // Act
        tracker.recordSpeech(Duration.ofSeconds(30));
        tracker.recordSpeech(Duration.ofSeconds(90));
        tracker.recordSpeech(Duration.ZERO);
        tracker.recordSpeech(Duration.ofSeconds(-5));
        tracker.recordSpeech(null);

        // Assert
        assertThat(tracker.totalSpeech()).isEqualTo(Duration.ofMinutes(2));
        assertThat(tracker.estimatedCostUsd()).isCloseTo(0.0576, within(1e-9));
        assertThat(meterRegistry.get("stt.speech.seconds").tag("engine", "vosk").counter().count())
                .isEqualTo(120.0);
    }

    @Test
    void shouldPersistLatestTotalsOnFlush() {
        // Arrange
        tracker.recordSpeech(Duration.ofSeconds(45));

        // Act
        tracker.flush();
        tracker.recordSpeech(Duration.ofSeconds(15));
        tracker.flush();

        // Assert
        ArgumentCaptor<UsageRecord> captor = ArgumentCaptor.forClass(UsageRecord.class);
        verify(store, times(2)).upsertUsage(captor.capture());
        UsageRecord last = captor.getAllValues().get(1);
        assertThat(last.sessionId()).isEqualTo("s1");
        assertThat(last.engine()).isEqualTo("vosk");
        assertThat(last.speechSeconds()).isEqualTo(60.0);
        assertThat(last.estimatedCostUsd()).isCloseTo(0.0288, within(1e-9));
    }

    @Test
    void shouldKeepCountingPastCostThreshold() {
        // Arrange: $1 is roughly 34.7 minutes
        tracker.recordSpeech(Duration.ofMinutes(40));

        // Act
        tracker.recordSpeech(Duration.ofMinutes(10));

        // Assert
        assertThat(tracker.totalSpeech()).isEqualTo(Duration.ofMinutes(50));
        assertThat(tracker.estimatedCostUsd()).isGreaterThan(1.0);
    }
}
