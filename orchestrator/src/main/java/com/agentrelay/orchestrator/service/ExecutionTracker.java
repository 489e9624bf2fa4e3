package com.agentrelay.orchestrator.service;

import com.agentrelay.orchestrator.model.ExecutionResult;
import com.agentrelay.orchestrator.model.RunResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of runs and their stages, for polling. Finished runs
 * are dropped by {@link #purgeFinishedBefore}.
 */
public class ExecutionTracker {

    private final Map<String, RunRecord> runs = new ConcurrentHashMap<>();
    private final Clock clock;

    public ExecutionTracker() {
        this(Clock.systemUTC());
    }

    public ExecutionTracker(Clock clock) {
        this.clock = clock;
    }

    public RunRecord register(String runId, String userId) {
        return runs.computeIfAbsent(runId, id -> new RunRecord(id, userId, clock.instant()));
    }

    public Optional<RunRecord> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    void markRunning(String runId, String userId) {
        register(runId, userId).markRunning(clock.instant());
    }

    /** @return the stage index to pass to {@link #stageFinished}, or -1 for an unknown run */
    int stageStarted(String runId, String agentName) {
        RunRecord run = runs.get(runId);
        return run == null ? -1 : run.addStage(agentName, clock.instant());
    }

    void stageFinished(String runId, int index, ExecutionResult result) {
        RunRecord run = runs.get(runId);
        if (run == null || index < 0) return;
        StageState state = !result.success() ? StageState.FAILED
                : result.isDegraded() ? StageState.DEGRADED
                : StageState.COMPLETED;
        Double score = result.metrics().get("quality_score");
        run.finishStage(index, state, (int) result.metric("attempts", 1), score, result.error(), clock.instant());
    }

    /** One per agent attempt; a stage that stops beating is reported by {@link #markStalledStages}. */
    void heartbeat(String runId, int index) {
        RunRecord run = runs.get(runId);
        if (run != null) run.heartbeat(index, clock.instant());
    }

    /**
     * Marks running stages with no heartbeat for longer than {@code timeout} as
     * {@link StageState#STALLED}. A later heartbeat or finish overrides the mark.
     *
     * @return run id to the agent names newly marked, empty if none
     */
    public Map<String, List<String>> markStalledStages(Duration timeout) {
        Instant cutoff = clock.instant().minus(timeout);
        Map<String, List<String>> stalled = new LinkedHashMap<>();
        runs.forEach((runId, run) -> {
            List<String> agents = run.markStalled(cutoff);
            if (!agents.isEmpty()) stalled.put(runId, agents);
        });
        return stalled;
    }

    void complete(RunResult result) {
        RunRecord run = runs.get(result.runId());
        if (run != null) run.complete(result, clock.instant());
    }

    public void fail(String runId, String message) {
        RunRecord run = runs.get(runId);
        if (run != null) run.fail(message, clock.instant());
    }

    /** @return number of records removed */
    public int purgeFinishedBefore(Instant cutoff) {
        int before = runs.size();
        runs.values().removeIf(r -> r.finishedBefore(cutoff));
        return before - runs.size();
    }

    public int size() {
        return runs.size();
    }
}
