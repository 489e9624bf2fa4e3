package com.agentrelay.orchestrator.pool;

public class PoolClosedException extends IllegalStateException {
    public PoolClosedException(String poolName) {
        super("pool is closed: '" + poolName + "'");
    }
}
