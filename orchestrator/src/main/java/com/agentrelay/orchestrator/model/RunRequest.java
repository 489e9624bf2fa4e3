package com.agentrelay.orchestrator.model;

import java.util.Map;

/**
 * A user request submitted to the supervisor.
 *
 * @param plan optional; the supervisor's default plan is used when null
 */
public record RunRequest(
        String              userId,
        String              threadId,
        String              message,
        Map<String, Object> metadata,
        ExecutionPlan       plan) {

    public RunRequest {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (message == null) message = "";
        if (metadata == null) metadata = Map.of();
    }

    public RunRequest(String userId, String message) {
        this(userId, null, message, Map.of(), null);
    }
}
