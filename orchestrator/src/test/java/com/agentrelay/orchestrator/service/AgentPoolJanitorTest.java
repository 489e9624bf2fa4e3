package com.agentrelay.orchestrator.service;

import com.agentrelay.orchestrator.model.RunStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AgentPoolJanitorTest {

    @Test
    void sweep_evictsIdleAgentsAndPurgesOldRuns() {
        AgentPoolTest.MutableClock clock = new AgentPoolTest.MutableClock();
        AgentPool pool = new AgentPool(5, new OrchestrationMetrics(new SimpleMeterRegistry()), clock);
        ExecutionTracker tracker = new ExecutionTracker(clock);
        AgentPoolJanitor janitor = new AgentPoolJanitor(pool, tracker, Duration.ofMinutes(30), Duration.ofMinutes(5), clock);

        pool.getOrCreateAgent("alice");
        pool.releaseAgent("alice");
        tracker.register("r1", "alice");
        tracker.fail("r1", "boom");
        tracker.register("r2", "alice");

        clock.advance(Duration.ofHours(2));
        janitor.sweep();

        assertThat(pool.pooledCount()).isZero();
        assertThat(tracker.find("r1")).isEmpty();
        assertThat(tracker.find("r2")).isPresent();
    }

    @Test
    void sweep_marksStagesWithoutHeartbeatStalled() {
        AgentPoolTest.MutableClock clock = new AgentPoolTest.MutableClock();
        AgentPool pool = new AgentPool(5, new OrchestrationMetrics(new SimpleMeterRegistry()), clock);
        ExecutionTracker tracker = new ExecutionTracker(clock);
        AgentPoolJanitor janitor = new AgentPoolJanitor(pool, tracker, Duration.ofMinutes(30), Duration.ofMinutes(5), clock);

        tracker.register("r1", "alice");
        tracker.markRunning("r1", "alice");
        tracker.stageStarted("r1", "data");

        clock.advance(Duration.ofMinutes(6));
        janitor.sweep();

        RunRecord run = tracker.find("r1").orElseThrow();
        assertThat(run.stages()).extracting(StageRecord::state).containsExactly(StageState.STALLED);
        assertThat(run.status()).isEqualTo(RunStatus.RUNNING);
    }
}
