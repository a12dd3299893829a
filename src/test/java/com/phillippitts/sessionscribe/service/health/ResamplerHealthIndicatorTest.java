package com.phillippitts.sessionscribe.service.health;

import com.phillippitts.sessionscribe.config.properties.RecordingProperties;
import com.phillippitts.sessionscribe.config.properties.ResamplerProperties;
import com.phillippitts.sessionscribe.domain.SessionSpeakerKey;
import com.phillippitts.sessionscribe.service.resampler.ResamplerRegistry;
import com.phillippitts.sessionscribe.testutil.FakeProcessFactory;
import com.phillippitts.sessionscribe.testutil.ManualTaskScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ResamplerHealthIndicatorTest {

    private final FakeProcessFactory processFactory = new FakeProcessFactory();
    private final ResamplerRegistry registry = new ResamplerRegistry(processFactory, new ResamplerProperties(),
            new RecordingProperties(), new ManualTaskScheduler(Instant.parse("2026-03-01T20:00:00Z")),
            new SimpleMeterRegistry(), null);
    private final ResamplerHealthIndicator indicator = new ResamplerHealthIndicator(registry);

    @AfterEach
    void tearDown() {
        registry.killAll();
    }

    @Test
    void shouldReportUpWithActiveProcessCount() {
        // Arrange
        registry.spawn(SessionSpeakerKey.of("s1", "alice"));

        // Act
        Health health = indicator.health();

        // Assert
        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("activeProcesses", 1);
        assertThat(health.getDetails()).containsEntry("openBreakers", 0L);
    }

    @Test
    void shouldReportDegradedWhenBreakerOpen() {
        // Arrange
        processFactory.failNext(3);
        SessionSpeakerKey key = SessionSpeakerKey.of("s1", "bob");
        for (int i = 0; i < 3; i++) {
            registry.spawn(key);
        }

        // Act
        Health health = indicator.health();

        // Assert
        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("openBreakers", 1L);
    }
}
