package com.agentrelay.orchestrator.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Progress notification for one run, delivered to the transport layer.
 *
 * @param agentName null for run-level events
 * @param payload   event-specific details (e.g. {@code execution_time_ms}, {@code error})
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StageEvent(
        StageEventType      type,
        String              runId,
        String              userId,
        String              agentName,
        Map<String, Object> payload,
        Instant             timestamp) {

    public StageEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        if (timestamp == null) timestamp = Instant.now();
    }

    public static StageEvent of(StageEventType type, String runId, String userId,
                                String agentName, Map<String, Object> payload) {
        return new StageEvent(type, runId, userId, agentName, payload, Instant.now());
    }
}
