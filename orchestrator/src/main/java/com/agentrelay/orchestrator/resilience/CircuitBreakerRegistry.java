package com.agentrelay.orchestrator.resilience;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link CircuitBreaker} per guarded target (agent key), created lazily
 * with shared defaults.
 */
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int      failureThreshold;
    private final Duration recoveryTimeout;

    public CircuitBreakerRegistry(int failureThreshold, Duration recoveryTimeout) {
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout  = recoveryTimeout;
    }

    public CircuitBreaker forName(String name) {
        return breakers.computeIfAbsent(name,
                n -> new CircuitBreaker(n, failureThreshold, recoveryTimeout));
    }

    /** Snapshot of breaker states, sorted by name. */
    public Map<String, CircuitState> states() {
        Map<String, CircuitState> out = new TreeMap<>();
        breakers.forEach((name, breaker) -> out.put(name, breaker.state()));
        return out;
    }
}
