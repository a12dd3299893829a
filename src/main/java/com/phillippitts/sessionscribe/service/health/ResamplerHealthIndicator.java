package com.phillippitts.sessionscribe.service.health;

import com.phillippitts.sessionscribe.service.resampler.ResamplerRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Resampler subprocess health.
 *
 * <ul>
 *   <li>UP: no spawn circuit breaker open</li>
 *   <li>DEGRADED: at least one speaker's breaker open (ffmpeg failing on spawn)</li>
 * </ul>
 */
@Component
public class ResamplerHealthIndicator implements HealthIndicator {

    private final ResamplerRegistry registry;

    public ResamplerHealthIndicator(ResamplerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        long open = registry.getBreaker().openCount();
        Health.Builder builder = open == 0
                ? Health.up()
                : Health.status("DEGRADED").withDetail("status", "Resampler spawns failing");
        return builder.withDetail("activeProcesses", registry.size())
                .withDetail("openBreakers", open)
                .build();
    }
}
