package com.agentrelay.orchestrator.api.dto;

import com.agentrelay.orchestrator.service.StageRecord;

import java.time.Instant;

/**
 * Read-only view of a stage returned by GET /runs/{id}/stages.
 */
public record StageResponse(
        int     index,
        String  agent,
        String  state,
        int     attempts,
        Double  qualityScore,
        String  error,
        Instant startedAt,
        Instant finishedAt,
        int     heartbeats,
        Instant lastHeartbeat
) {
    public static StageResponse from(StageRecord s) {
        return new StageResponse(
                s.index(),
                s.agentName(),
                s.state().value(),
                s.attempts(),
                s.qualityScore(),
                s.error(),
                s.startedAt(),
                s.finishedAt(),
                s.heartbeats(),
                s.lastHeartbeat()
        );
    }
}
