package com.phillippitts.sessionscribe.service.gate;

import com.phillippitts.sessionscribe.config.properties.RecordingProperties;
import com.phillippitts.sessionscribe.config.properties.ResamplerProperties;
import com.phillippitts.sessionscribe.config.properties.SttProperties;
import com.phillippitts.sessionscribe.domain.SessionSpeakerKey;
import com.phillippitts.sessionscribe.domain.TranscriptEvent;
import com.phillippitts.sessionscribe.persistence.RecordingStore;
import com.phillippitts.sessionscribe.service.resampler.ResamplerRegistry;
import com.phillippitts.sessionscribe.service.stt.EngineKey;
import com.phillippitts.sessionscribe.service.stt.EngineRegistry;
import com.phillippitts.sessionscribe.service.usage.UsageTracker;
import com.phillippitts.sessionscribe.service.voice.SpeakingSignalSource;
import com.phillippitts.sessionscribe.testutil.FakeProcessFactory;
import com.phillippitts.sessionscribe.testutil.FakeSttEngine;
import com.phillippitts.sessionscribe.testutil.ManualTaskScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class SttOrchestratorTest {

    private static final EngineKey KEY = new EngineKey("fake", "fake-model");
    private final SessionSpeakerKey alice = SessionSpeakerKey.of("s1", "alice");

    private ManualTaskScheduler scheduler;
    private FakeProcessFactory processFactory;
    private ResamplerRegistry resamplers;
    private FakeSttEngine engine;
    private EngineRegistry engines;
    private SpeakingSignalSource signals;
    private SttProperties props;
    private List<TranscriptEvent> delivered;
    private SttOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler(Instant.parse("2026-03-01T20:00:00Z"));
        processFactory = new FakeProcessFactory();
        resamplers = new ResamplerRegistry(processFactory, new ResamplerProperties(), new RecordingProperties(),
                scheduler, new SimpleMeterRegistry(), null);
        engine = new FakeSttEngine();
        engines = new EngineRegistry(key -> engine);
        signals = new SpeakingSignalSource();
        props = new SttProperties();
        delivered = new CopyOnWriteArrayList<>();
        orchestrator = newOrchestrator("s1");
    }

    @AfterEach
    void tearDown() {
        orchestrator.destroy();
        resamplers.killAll();
    }

    @Test
    void shouldRequireLiveResamplerToAddUser() {
        // Act
        boolean withoutResampler = orchestrator.addUser("alice");
        resamplers.spawn(alice);
        boolean withResampler = orchestrator.addUser("alice");
        boolean again = orchestrator.addUser("alice");

        // Assert
        assertThat(withoutResampler).isFalse();
        assertThat(withResampler).isTrue();
        assertThat(again).isTrue();
        assertThat(orchestrator.gateCount()).isEqualTo(1);
    }

    @Test
    void shouldCapConcurrentGates() {
        // Arrange
        props.setMaxConcurrentStreams(1);
        resamplers.spawn(alice);
        resamplers.spawn(SessionSpeakerKey.of("s1", "bob"));

        // Act
        boolean first = orchestrator.addUser("alice");
        boolean second = orchestrator.addUser("bob");

        // Assert
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(orchestrator.gate("bob")).isNull();
    }

    @Test
    void shouldRouteSpeakingEdgesToGate() {
        // Arrange
        resamplers.spawn(alice);
        orchestrator.addUser("alice");

        // Act
        signals.speakingStarted("alice");
        signals.speakingStarted("nobody");

        // Assert
        assertThat(engine.streams()).hasSize(1);
        assertThat(orchestrator.gate("alice").isSpeaking()).isTrue();

        signals.speakingEnded("alice");
        assertThat(orchestrator.gate("alice").isSpeaking()).isFalse();
    }

    @Test
    void shouldRespawnDeadResamplerAndRebuildGate() {
        // Arrange
        resamplers.spawn(alice);
        orchestrator.addUser("alice");
        VadGate original = orchestrator.gate("alice");
        scheduler.advance(Duration.ofMinutes(1));
        processFactory.last().exit(1);

        // Act
        signals.speakingStarted("alice");

        // Assert
        VadGate rebuilt = orchestrator.gate("alice");
        assertThat(original.isDestroyed()).isTrue();
        assertThat(rebuilt).isNotSameAs(original);
        assertThat(rebuilt.isBoundTo(resamplers.get(alice))).isTrue();
        assertThat(processFactory.commands()).hasSize(2);
        assertThat(rebuilt.hasOpenStream()).isTrue();
    }

    @Test
    void shouldRebindGateWhenResamplerWasReplaced() {
        // Arrange
        resamplers.spawn(alice);
        orchestrator.addUser("alice");
        VadGate original = orchestrator.gate("alice");
        resamplers.spawn(alice);

        // Act
        signals.speakingStarted("alice");

        // Assert
        assertThat(original.isDestroyed()).isTrue();
        assertThat(orchestrator.gate("alice").isBoundTo(resamplers.get(alice))).isTrue();
        assertThat(processFactory.commands()).hasSize(2);
    }

    @Test
    void shouldDropGateWhenRespawnIsRefused() {
        // Arrange
        resamplers.spawn(alice);
        orchestrator.addUser("alice");
        for (int i = 0; i < 3; i++) {
            resamplers.spawn(alice);
            processFactory.last().exit(1);
        }

        // Act
        signals.speakingStarted("alice");

        // Assert
        assertThat(orchestrator.gate("alice")).isNull();
        assertThat(orchestrator.gateCount()).isZero();
    }

    @Test
    void shouldDestroyGateOnRemoveUser() {
        // Arrange
        resamplers.spawn(alice);
        orchestrator.addUser("alice");
        VadGate gate = orchestrator.gate("alice");

        // Act
        orchestrator.removeUser("alice");
        orchestrator.removeUser("alice");

        // Assert
        assertThat(gate.isDestroyed()).isTrue();
        assertThat(orchestrator.gateCount()).isZero();
    }

    @Test
    void shouldReleaseSharedEngineOnlyWhenLastSessionEnds() {
        // Arrange
        SttOrchestrator second = newOrchestrator("s2");
        assertThat(engines.referenceCount(KEY)).isEqualTo(2);

        // Act
        orchestrator.destroy();
        orchestrator.destroy();

        // Assert
        assertThat(engines.referenceCount(KEY)).isEqualTo(1);
        assertThat(engine.isClosed()).isFalse();
        assertThat(signals.listenerCount()).isEqualTo(1);

        second.destroy();
        assertThat(engines.referenceCount(KEY)).isZero();
        assertThat(engine.isClosed()).isTrue();
        assertThat(orchestrator.addUser("alice")).isFalse();
    }

    private SttOrchestrator newOrchestrator(String sessionId) {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        UsageTracker usage = new UsageTracker(sessionId, "fake", mock(RecordingStore.class), 100.0, meterRegistry);
        return new SttOrchestrator(sessionId, resamplers, engines, KEY, delivered::add, usage, props, scheduler,
                meterRegistry, null, signals);
    }
}
