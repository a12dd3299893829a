package com.phillippitts.sessionscribe.service.stt.vosk;

import com.phillippitts.sessionscribe.domain.TranscriptEvent;
import com.phillippitts.sessionscribe.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.vosk.Recognizer;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VoskSttStreamTest {

    private static final Instant T0 = Instant.parse("2026-03-01T20:00:00Z");
    // 100 ms of 16 kHz mono 16-bit audio
    private static final byte[] CHUNK = new byte[3200];

    private MutableClock clock;
    private Recognizer recognizer;
    private List<TranscriptEvent> events;
    private VoskSttStream stream;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        recognizer = mock(Recognizer.class);
        events = new ArrayList<>();
        stream = new VoskSttStream("alice", 3, recognizer, events::add, clock, 16_000, 2, "small");
    }

    @Test
    void shouldAnchorOffsetsOnFirstWrite() {
        // Arrange
        clock.advance(Duration.ofSeconds(5));
        when(recognizer.acceptWaveForm(any(byte[].class), anyInt())).thenReturn(true);
        when(recognizer.getResult()).thenReturn(
                "{\"text\":\"hi there\",\"result\":[{\"word\":\"hi\",\"start\":0.2,\"end\":0.4,\"conf\":1.0},"
                        + "{\"word\":\"there\",\"start\":0.5,\"end\":0.9,\"conf\":0.5}]}");

        // Act
        stream.write(CHUNK);

        // Assert
        assertThat(events).hasSize(1);
        TranscriptEvent event = events.get(0);
        assertThat(event.isFinal()).isTrue();
        assertThat(event.segmentStart()).isEqualTo(T0.plusMillis(5_200));
        assertThat(event.segmentEnd()).isEqualTo(T0.plusMillis(5_900));
        assertThat(event.resultId()).isEqualTo("u0");
        assertThat(event.streamSequence()).isEqualTo(3);
        assertThat(event.confidence()).isEqualTo(0.75);
        assertThat(event.model()).isEqualTo("small");
    }

    @Test
    void shouldShareResultIdBetweenInterimsAndFinal() {
        // Arrange
        when(recognizer.acceptWaveForm(any(byte[].class), anyInt())).thenReturn(false, false, true, false);
        when(recognizer.getPartialResult()).thenReturn("{\"partial\":\"good\"}", "{\"partial\":\"good eve\"}",
                "{\"partial\":\"next\"}");
        when(recognizer.getResult()).thenReturn("{\"text\":\"good evening\"}");

        // Act
        stream.write(CHUNK);
        clock.advance(Duration.ofSeconds(1));
        stream.write(CHUNK);
        stream.write(CHUNK);
        clock.advance(Duration.ofSeconds(1));
        stream.write(CHUNK);

        // Assert
        assertThat(events).extracting(TranscriptEvent::text)
                .containsExactly("good", "good eve", "good evening", "next");
        assertThat(events).extracting(TranscriptEvent::resultId).containsExactly("u0", "u0", "u0", "u1");
        assertThat(events.get(3).segmentStart()).isEqualTo(T0.plusMillis(300));
    }

    @Test
    void shouldThrottleInterims() {
        // Arrange
        when(recognizer.acceptWaveForm(any(byte[].class), anyInt())).thenReturn(false);
        when(recognizer.getPartialResult()).thenReturn("{\"partial\":\"a\"}", "{\"partial\":\"a b\"}",
                "{\"partial\":\"a b c\"}");

        // Act
        stream.write(CHUNK);
        clock.advance(Duration.ofMillis(100));
        stream.write(CHUNK);
        clock.advance(Duration.ofMillis(500));
        stream.write(CHUNK);

        // Assert
        assertThat(events).extracting(TranscriptEvent::text).containsExactly("a", "a b c");
    }

    @Test
    void shouldFlushFinalResultOnClose() {
        // Arrange
        when(recognizer.acceptWaveForm(any(byte[].class), anyInt())).thenReturn(false);
        when(recognizer.getPartialResult()).thenReturn("{\"partial\":\"\"}");
        when(recognizer.getFinalResult()).thenReturn("{\"text\":\"bye\"}");
        stream.write(CHUNK);

        // Act
        stream.close();
        stream.close();

        // Assert
        assertThat(events).extracting(TranscriptEvent::text).containsExactly("bye");
        assertThat(stream.isOpen()).isFalse();
        verify(recognizer, times(1)).close();
    }

    @Test
    void shouldSkipFinalFlushWhenNoAudioWasWritten() {
        // Act
        stream.close();

        // Assert
        assertThat(events).isEmpty();
        verify(recognizer, never()).getFinalResult();
    }

    @Test
    void shouldCloseAndNotifyWhenRecognizerFails() {
        // Arrange
        AtomicInteger closeCallbacks = new AtomicInteger();
        stream.setOnClose(closeCallbacks::incrementAndGet);
        when(recognizer.acceptWaveForm(any(byte[].class), anyInt())).thenThrow(new IllegalStateException("jni"));

        // Act
        stream.write(CHUNK);
        stream.write(CHUNK);

        // Assert
        assertThat(stream.isOpen()).isFalse();
        assertThat(closeCallbacks.get()).isEqualTo(1);
        verify(recognizer, times(1)).acceptWaveForm(any(byte[].class), anyInt());
    }
}
