package com.agentrelay.orchestrator.service;

import java.time.Instant;

/**
 * Tracking entry for one stage of a run. Immutable; the tracker replaces it
 * on every heartbeat and when the stage finishes.
 */
public record StageRecord(
        int        index,
        String     agentName,
        StageState state,
        int        attempts,
        Double     qualityScore,
        String     error,
        Instant    startedAt,
        Instant    finishedAt,
        int        heartbeats,
        Instant    lastHeartbeat) {

    static StageRecord started(int index, String agentName, Instant now) {
        return new StageRecord(index, agentName, StageState.RUNNING, 0, null, null, now, null, 0, now);
    }

    StageRecord beat(Instant now) {
        StageState next = state == StageState.STALLED ? StageState.RUNNING : state;
        return new StageRecord(index, agentName, next, attempts, qualityScore, error, startedAt, finishedAt,
                heartbeats + 1, now);
    }

    StageRecord stall() {
        return new StageRecord(index, agentName, StageState.STALLED, attempts, qualityScore, error, startedAt,
                finishedAt, heartbeats, lastHeartbeat);
    }

    StageRecord finish(StageState state, int attempts, Double qualityScore, String error, Instant now) {
        return new StageRecord(index, agentName, state, attempts, qualityScore, error, startedAt, now,
                heartbeats, lastHeartbeat);
    }

    /** Still in flight with no heartbeat since {@code cutoff}. */
    boolean silentSince(Instant cutoff) {
        return state == StageState.RUNNING && lastHeartbeat.isBefore(cutoff);
    }
}
