package com.automaker.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event emitted during auto-mode execution, published via {@link EventBus}.
 *
 * @param type        what happened
 * @param projectPath project the event belongs to
 * @param featureId   feature the event concerns, null for loop-level events
 * @param payload     event-specific data
 * @param timestamp   when the event was created
 */
public record AutoModeEvent(
    AutoModeEventType type,
    String projectPath,
    String featureId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static AutoModeEvent of(AutoModeEventType type, String projectPath, String featureId,
                                   Map<String, Object> payload) {
        return new AutoModeEvent(type, projectPath, featureId,
                payload != null ? Map.copyOf(withoutNulls(payload)) : Map.of(), Instant.now());
    }

    public static AutoModeEvent of(AutoModeEventType type, String projectPath, Map<String, Object> payload) {
        return of(type, projectPath, null, payload);
    }

    /** Flattened form used for SSE frames: type, featureId, projectPath, then the payload. */
    public Map<String, Object> toWireMap() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", type.wireName());
        if (featureId != null) {
            data.put("featureId", featureId);
        }
        data.put("projectPath", projectPath);
        data.putAll(payload);
        data.put("timestamp", timestamp.toString());
        return data;
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> payload) {
        Map<String, Object> copy = new LinkedHashMap<>();
        payload.forEach((k, v) -> {
            if (v != null) {
                copy.put(k, v);
            }
        });
        return copy;
    }
}
