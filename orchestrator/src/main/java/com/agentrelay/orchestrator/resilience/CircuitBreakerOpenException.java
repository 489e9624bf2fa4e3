package com.agentrelay.orchestrator.resilience;

/**
 * Raised without invoking the guarded operation while a breaker is open.
 */
public class CircuitBreakerOpenException extends RuntimeException {

    private final String breakerName;

    public CircuitBreakerOpenException(String breakerName) {
        super("Circuit breaker open: '" + breakerName + "'");
        this.breakerName = breakerName;
    }

    public String getBreakerName() { return breakerName; }
}
