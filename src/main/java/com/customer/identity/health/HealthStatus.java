package com.customer.identity.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one health check, or of the whole engine, with free-form details such as
 * database latency or the sources whose last sync batch failed.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    /**
     * Declared from best to worst; the aggregate status of the engine is the worst one reported.
     */
    public enum Status {
        UP,
        DEGRADED,
        DOWN;

        boolean isWorseThan(Status other) {
            return compareTo(other) > 0;
        }
    }

    public HealthStatus {
        details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static HealthStatus up() {
        return up("OK");
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, null);
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, null);
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, null);
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new HealthStatus(status, message, merged);
    }

    public boolean isWorseThan(HealthStatus other) {
        return status.isWorseThan(other.status);
    }

    /**
     * The worse of the two; {@code this} on a tie.
     */
    public HealthStatus worse(HealthStatus other) {
        return other.isWorseThan(this) ? other : this;
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
