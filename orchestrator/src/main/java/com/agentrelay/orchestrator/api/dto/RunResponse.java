package com.agentrelay.orchestrator.api.dto;

import com.agentrelay.orchestrator.model.RunResult;
import com.agentrelay.orchestrator.service.RunRecord;

import java.time.Instant;
import java.util.Map;

/**
 * Response body for POST /runs and GET /runs/{id}.
 * {@code state} is the merged stage output once the run has finished, null before.
 */
public record RunResponse(
        String              runId,
        String              userId,
        String              status,
        Instant             createdAt,
        Instant             startedAt,
        Instant             finishedAt,
        int                 stages,
        String              error,
        Map<String, Object> state
) {
    public static RunResponse from(RunRecord run) {
        RunResult result = run.result();
        return new RunResponse(
                run.runId(),
                run.userId(),
                run.status().value(),
                run.createdAt(),
                run.startedAt(),
                run.finishedAt(),
                run.stages().size(),
                run.error(),
                result != null ? result.state().asMap() : null
        );
    }
}
