package com.foreman.core.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of checking one component. {@code metadata} carries component-specific counts
 * such as pending tasks or agents per lifecycle state.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus up(String component, String detail) {
        return up(component, detail, Map.of());
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    public static HealthStatus degraded(String component, String detail) {
        return new HealthStatus(component, Status.DEGRADED, detail, Map.of());
    }
}
