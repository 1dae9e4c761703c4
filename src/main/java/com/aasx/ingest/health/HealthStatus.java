package com.aasx.ingest.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a {@link HealthCheck}: up or down, a message and detail values.
 */
public record HealthStatus(boolean up, String message, Map<String, Object> details) {

    public HealthStatus {
        message = message != null ? message : "";
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(true, message, Map.of());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(false, reason, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(details);
        copy.put(key, value);
        return new HealthStatus(up, message, copy);
    }
}
