package com.tessera.core.health;

import java.util.List;
import java.util.Map;

/**
 * Result of one component check. Only the reasoning backend is required for
 * executions to run; the knowledge server, sandbox and git each disable one
 * feature when they are missing.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DEGRADED, DOWN }

    public static final String BACKEND = "backend";

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DOWN, detail, metadata);
    }

    /** True when no execution can run because of this component. */
    public boolean blocksExecutions() {
        return status == Status.DOWN && BACKEND.equals(component);
    }

    /**
     * DOWN if executions are blocked, DEGRADED if any optional component is not UP,
     * otherwise UP.
     */
    public static Status overall(List<HealthStatus> checks) {
        if (checks.stream().anyMatch(HealthStatus::blocksExecutions)) {
            return Status.DOWN;
        }
        return checks.stream().allMatch(c -> c.status() == Status.UP) ? Status.UP : Status.DEGRADED;
    }
}
