package com.worker.lookup.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of one component or of the whole lookup subsystem, with detail values
 * for the admin health endpoint.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    /** Ordered from best to worst. */
    public enum Status {
        UP, DEGRADED, DOWN;

        public boolean isWorseThan(Status other) {
            return ordinal() > other.ordinal();
        }

        /** DEGRADED still answers searches, only slower or from a colder cache. */
        public boolean servesTraffic() {
            return this != DOWN;
        }
    }

    public HealthStatus {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        message = message != null ? message : "";
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return of(Status.UP, "OK");
    }

    public static HealthStatus of(Status status, String message) {
        return new HealthStatus(status, message, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new HealthStatus(status, message, merged);
    }
}
