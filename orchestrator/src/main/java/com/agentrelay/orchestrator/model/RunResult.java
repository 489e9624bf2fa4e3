package com.agentrelay.orchestrator.model;

import java.time.Instant;
import java.util.List;

/**
 * Final outcome of a run: merged state plus one result per executed stage,
 * in execution order.
 */
public record RunResult(
        String                runId,
        RunStatus             status,
        AgentState            state,
        List<ExecutionResult> stageResults,
        Instant               startedAt,
        Instant               finishedAt) {

    public RunResult {
        stageResults = List.copyOf(stageResults);
    }

    public long successfulStages() {
        return stageResults.stream().filter(ExecutionResult::success).count();
    }
}
