package com.agentrelay.orchestrator.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Point-in-time copy of {@link OrchestrationMetrics}.
 *
 * @param successRate percentage in [0, 100]; 0.0 before the first execution
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrchestrationSnapshot(
        long   agentsCreated,
        long   agentsDestroyed,
        int    activeAgents,
        int    pooledAgents,
        int    concurrentPeak,
        long   totalExecutions,
        long   failedExecutions,
        double averageExecutionTime,
        double successRate) {}
