package com.agentrelay.orchestrator.service;

import java.time.Duration;

/**
 * Defaults the supervisor applies when an agent's policy does not override them.
 *
 * @param maxRegenerations extra generations after a failed quality check
 */
public record SupervisorSettings(
        Duration stageTimeout,
        int      maxAttempts,
        Duration retryDelay,
        double   backoffFactor,
        int      maxRegenerations) {

    public SupervisorSettings {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (maxRegenerations < 0) throw new IllegalArgumentException("maxRegenerations must be >= 0");
    }
}
