package com.agentrelay.orchestrator.resilience;

import java.time.Duration;

/**
 * Thrown by {@link TimeoutExecutor} when an operation overruns its bound.
 * Retryable: the retry layer treats it like any other transient failure.
 */
public class ServiceTimeoutException extends RuntimeException {

    private final String   label;
    private final Duration timeout;

    public ServiceTimeoutException(String label, Duration timeout) {
        super("'" + label + "' timed out after " + timeout.toMillis() + " ms");
        this.label   = label;
        this.timeout = timeout;
    }

    public String  getLabel()   { return label; }
    public Duration getTimeout() { return timeout; }
}
