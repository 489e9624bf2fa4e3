package com.agentrelay.orchestrator.service;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Aggregate counters of the supervisor and the agent pool.
 *
 * <p>All fields are guarded by one lock and only reachable through the
 * {@code record*} methods and {@link #snapshot()}. The agent pool calls in
 * while holding its own lock; this class never calls back out, so the lock
 * order is always pool → metrics.
 *
 * <p>Mirrored to Micrometer as {@code agentrelay.agents.*} gauges and
 * {@code agentrelay.stage.executions} counters.
 */
public class OrchestrationMetrics {

    private final ReentrantLock lock = new ReentrantLock();
    private final MeterRegistry meterRegistry;

    private long agentsCreated;
    private long agentsDestroyed;
    private int  activeAgents;
    private int  pooledAgents;
    private int  concurrentPeak;
    private long totalExecutions;
    private long failedExecutions;
    private long totalExecutionMillis;

    public OrchestrationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        Gauge.builder("agentrelay.agents.active", this, m -> m.snapshot().activeAgents())
                .register(meterRegistry);
        Gauge.builder("agentrelay.agents.pooled", this, m -> m.snapshot().pooledAgents())
                .register(meterRegistry);
        Gauge.builder("agentrelay.agents.peak", this, m -> m.snapshot().concurrentPeak())
                .register(meterRegistry);
    }

    // ------------------------------------------------------------------
    // Stage executions
    // ------------------------------------------------------------------

    public void recordSuccess(long durationMillis) {
        lock.lock();
        try {
            totalExecutions++;
            totalExecutionMillis += Math.max(0, durationMillis);
        } finally {
            lock.unlock();
        }
        meterRegistry.counter("agentrelay.stage.executions", "outcome", "success").increment();
    }

    public void recordFailure(long durationMillis) {
        lock.lock();
        try {
            totalExecutions++;
            failedExecutions++;
            totalExecutionMillis += Math.max(0, durationMillis);
        } finally {
            lock.unlock();
        }
        meterRegistry.counter("agentrelay.stage.executions", "outcome", "failure").increment();
    }

    // ------------------------------------------------------------------
    // Agent lifecycle
    // ------------------------------------------------------------------

    public void recordAgentCreated() {
        lock.lock();
        try {
            agentsCreated++;
        } finally {
            lock.unlock();
        }
    }

    public void recordAgentsDestroyed(int count) {
        lock.lock();
        try {
            agentsDestroyed += count;
        } finally {
            lock.unlock();
        }
    }

    /** Current pool occupancy; raises the concurrent peak when exceeded. */
    public void updateAgentCounts(int active, int pooled) {
        lock.lock();
        try {
            activeAgents   = active;
            pooledAgents   = pooled;
            concurrentPeak = Math.max(concurrentPeak, active);
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Snapshot
    // ------------------------------------------------------------------

    public OrchestrationSnapshot snapshot() {
        lock.lock();
        try {
            double average = totalExecutions == 0 ? 0.0 : (double) totalExecutionMillis / totalExecutions;
            double successRate = totalExecutions == 0
                    ? 0.0
                    : (double) (totalExecutions - failedExecutions) / totalExecutions * 100.0;
            return new OrchestrationSnapshot(agentsCreated, agentsDestroyed, activeAgents, pooledAgents,
                    concurrentPeak, totalExecutions, failedExecutions, average, successRate);
        } finally {
            lock.unlock();
        }
    }
}
