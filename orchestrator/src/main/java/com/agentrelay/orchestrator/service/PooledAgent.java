package com.agentrelay.orchestrator.service;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-user agent instance held by {@link AgentPool}. Reused across runs of the
 * same user. Mutable fields are written only under the pool lock.
 */
public final class PooledAgent {

    private final String  instanceId = UUID.randomUUID().toString();
    private final String  userId;
    private final Instant createdAt;
    private volatile Instant lastUsedAt;
    private volatile int     leases;
    private volatile long    runs;

    PooledAgent(String userId, Instant createdAt) {
        this.userId     = userId;
        this.createdAt  = createdAt;
        this.lastUsedAt = createdAt;
    }

    void lease(Instant now) {
        leases++;
        runs++;
        lastUsedAt = now;
    }

    /** @return remaining leases */
    int unlease(Instant now) {
        leases = Math.max(0, leases - 1);
        lastUsedAt = now;
        return leases;
    }

    public String  instanceId() { return instanceId; }
    public String  userId()     { return userId; }
    public Instant createdAt()  { return createdAt; }

    public Instant lastUsedAt() { return lastUsedAt; }
    public long    runs()       { return runs; }
    public int     leases()     { return leases; }
}
