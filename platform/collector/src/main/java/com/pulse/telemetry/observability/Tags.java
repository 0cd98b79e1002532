package com.pulse.telemetry.observability;

import java.util.HashMap;
import java.util.Map;

/**
 * Tag normalization: every key and value becomes a string.
 */
final class Tags {

    private Tags() {}

    static Map<String, String> normalize(Map<String, ?> tags) {
        if (tags == null || tags.isEmpty()) {
            return Map.of();
        }
        Map<String, String> normalized = new HashMap<>(tags.size());
        tags.forEach((k, v) -> normalized.put(String.valueOf(k), String.valueOf(v)));
        return normalized;
    }
}
