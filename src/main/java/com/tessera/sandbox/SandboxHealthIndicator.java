package com.tessera.sandbox;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health for the sandbox provider; pings the Docker daemon when Docker is used.
 */
@Component("sandbox")
public class SandboxHealthIndicator implements HealthIndicator {

    private final SandboxProvider provider;
    private final SandboxSessionRegistry registry;

    public SandboxHealthIndicator(SandboxProvider provider, SandboxSessionRegistry registry) {
        this.provider = provider;
        this.registry = registry;
    }

    @Override
    public Health health() {
        if (provider instanceof DockerSandboxProvider docker) {
            try {
                docker.ping();
            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("provider", provider.name())
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
        return Health.up()
                .withDetail("provider", provider.name())
                .withDetail("sessions", registry.size())
                .build();
    }
}
