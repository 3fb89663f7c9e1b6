package com.speaker.standardization.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of one pipeline dependency, or of the pipeline as a whole.
 * A run only starts when the aggregate status is {@link Status#UP}.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public enum Status { UP, DOWN }

    public HealthStatus {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return new HealthStatus(Status.UP, "OK", Map.of());
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> newDetails = new LinkedHashMap<>(this.details);
        newDetails.put(key, value);
        return new HealthStatus(this.status, this.message, newDetails);
    }

    public boolean isUp() {
        return status == Status.UP;
    }
}
