package com.agentrelay.orchestrator.service;

import com.agentrelay.orchestrator.model.RunResult;
import com.agentrelay.orchestrator.model.RunStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Live tracking view of one run, polled by the API while the run executes.
 * All accessors are synchronized on the record.
 */
public class RunRecord {

    private final String  runId;
    private final String  userId;
    private final Instant createdAt;

    private RunStatus status = RunStatus.PENDING;
    private Instant   startedAt;
    private Instant   finishedAt;
    private String    error;
    private RunResult result;
    private final List<StageRecord> stages = new ArrayList<>();

    RunRecord(String runId, String userId, Instant createdAt) {
        this.runId     = runId;
        this.userId    = userId;
        this.createdAt = createdAt;
    }

    public String  runId()     { return runId; }
    public String  userId()    { return userId; }
    public Instant createdAt() { return createdAt; }

    public synchronized RunStatus status()     { return status; }
    public synchronized Instant   startedAt()  { return startedAt; }
    public synchronized Instant   finishedAt() { return finishedAt; }
    public synchronized String    error()      { return error; }
    public synchronized RunResult result()     { return result; }

    public synchronized List<StageRecord> stages() {
        return List.copyOf(stages);
    }

    synchronized void markRunning(Instant now) {
        status = RunStatus.RUNNING;
        startedAt = now;
    }

    synchronized int addStage(String agentName, Instant now) {
        int index = stages.size();
        stages.add(StageRecord.started(index, agentName, now));
        return index;
    }

    synchronized void finishStage(int index, StageState state, int attempts, Double qualityScore,
                                  String error, Instant now) {
        stages.set(index, stages.get(index).finish(state, attempts, qualityScore, error, now));
    }

    synchronized void heartbeat(int index, Instant now) {
        if (index < 0 || index >= stages.size()) return;
        StageRecord stage = stages.get(index);
        if (stage.finishedAt() == null) {
            stages.set(index, stage.beat(now));
        }
    }

    /** @return agent names of the stages newly marked stalled */
    synchronized List<String> markStalled(Instant cutoff) {
        List<String> stalled = new ArrayList<>();
        for (int i = 0; i < stages.size(); i++) {
            StageRecord stage = stages.get(i);
            if (stage.silentSince(cutoff)) {
                stages.set(i, stage.stall());
                stalled.add(stage.agentName());
            }
        }
        return stalled;
    }

    synchronized void complete(RunResult runResult, Instant now) {
        result = runResult;
        status = runResult.status();
        finishedAt = now;
    }

    synchronized void fail(String message, Instant now) {
        status = RunStatus.FAILED;
        error = message;
        finishedAt = now;
    }

    synchronized boolean finishedBefore(Instant cutoff) {
        return status.isTerminal() && finishedAt != null && finishedAt.isBefore(cutoff);
    }
}
