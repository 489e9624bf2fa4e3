package com.agentrelay.orchestrator.service;

/**
 * The agent pool is at its concurrent-agent limit. Not retried: surfaced to
 * the caller (HTTP 429).
 */
public class CapacityExceededException extends RuntimeException {

    private final int limit;

    public CapacityExceededException(int limit) {
        super("Maximum concurrent agents reached (" + limit + ")");
        this.limit = limit;
    }

    public int getLimit() { return limit; }
}
