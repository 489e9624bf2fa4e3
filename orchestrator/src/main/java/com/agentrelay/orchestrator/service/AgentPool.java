package com.agentrelay.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-user agent instances.
 *
 * <pre>
 *   getOrCreateAgent(user):  active → reuse (extra lease)
 *                            free   → move to active
 *                            none   → create, unless active == maxConcurrent
 *   releaseAgent(user):      last lease → move to free (instance kept)
 *   evictIdle(maxIdle):      free instances idle longer than maxIdle are destroyed
 * </pre>
 *
 * Active and free maps are guarded by one lock; counts are pushed to
 * {@link OrchestrationMetrics} while it is held.
 */
public class AgentPool {

    private static final Logger log = LoggerFactory.getLogger(AgentPool.class);

    private final int                  maxConcurrent;
    private final OrchestrationMetrics metrics;
    private final Clock                clock;

    private final Object lock = new Object();
    private final Map<String, PooledAgent> active = new HashMap<>();
    private final Map<String, PooledAgent> free   = new LinkedHashMap<>();

    public AgentPool(int maxConcurrent, OrchestrationMetrics metrics) {
        this(maxConcurrent, metrics, Clock.systemUTC());
    }

    public AgentPool(int maxConcurrent, OrchestrationMetrics metrics, Clock clock) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1, got " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        this.metrics       = metrics;
        this.clock         = clock;
    }

    /**
     * @throws CapacityExceededException if a new activation would exceed the limit
     */
    public PooledAgent getOrCreateAgent(String userId) {
        Instant now = clock.instant();
        synchronized (lock) {
            PooledAgent agent = active.get(userId);
            if (agent != null) {
                agent.lease(now);
                return agent;
            }
            if (active.size() >= maxConcurrent) {
                throw new CapacityExceededException(maxConcurrent);
            }
            agent = free.remove(userId);
            if (agent == null) {
                agent = new PooledAgent(userId, now);
                metrics.recordAgentCreated();
                log.debug("Created agent instance {} for user {}", agent.instanceId(), userId);
            }
            agent.lease(now);
            active.put(userId, agent);
            metrics.updateAgentCounts(active.size(), free.size());
            return agent;
        }
    }

    /**
     * Releases one lease. The instance moves to the free pool once its last
     * lease is released.
     *
     * @return false if the user had no active instance
     */
    public boolean releaseAgent(String userId) {
        Instant now = clock.instant();
        synchronized (lock) {
            PooledAgent agent = active.get(userId);
            if (agent == null) {
                log.debug("Release for user {} without an active agent ignored", userId);
                return false;
            }
            if (agent.unlease(now) == 0) {
                active.remove(userId);
                free.put(userId, agent);
                metrics.updateAgentCounts(active.size(), free.size());
            }
            return true;
        }
    }

    /** Whether {@link #getOrCreateAgent} would currently succeed for this user. */
    public boolean hasCapacityFor(String userId) {
        synchronized (lock) {
            return active.containsKey(userId) || active.size() < maxConcurrent;
        }
    }

    /** @return number of destroyed instances */
    public int evictIdle(Duration maxIdle) {
        Instant cutoff = clock.instant().minus(maxIdle);
        int evicted = 0;
        synchronized (lock) {
            Iterator<PooledAgent> it = free.values().iterator();
            while (it.hasNext()) {
                if (it.next().lastUsedAt().isBefore(cutoff)) {
                    it.remove();
                    evicted++;
                }
            }
            if (evicted > 0) {
                metrics.recordAgentsDestroyed(evicted);
                metrics.updateAgentCounts(active.size(), free.size());
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} idle agent instance(s)", evicted);
        }
        return evicted;
    }

    public int activeCount() {
        synchronized (lock) { return active.size(); }
    }

    public int pooledCount() {
        synchronized (lock) { return free.size(); }
    }

    public int maxConcurrent() { return maxConcurrent; }
}
