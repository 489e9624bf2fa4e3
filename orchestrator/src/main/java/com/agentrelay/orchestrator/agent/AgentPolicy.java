package com.agentrelay.orchestrator.agent;

import java.time.Duration;

/**
 * Execution bounds for one agent. A null timeout or a non-positive attempt
 * count means "use the configured default".
 *
 * @param timeout     wall-clock limit for a single attempt
 * @param maxAttempts tries per stage, including the first
 */
public record AgentPolicy(Duration timeout, int maxAttempts) {

    public static AgentPolicy defaults() {
        return new AgentPolicy(null, 0);
    }

    public static AgentPolicy of(Duration timeout, int maxAttempts) {
        return new AgentPolicy(timeout, maxAttempts);
    }

    /** Local computation: short timeout, no retry. */
    public static AgentPolicy javaLocal() {
        return new AgentPolicy(Duration.ofSeconds(10), 1);
    }

    public Duration timeoutOr(Duration fallback) {
        return timeout != null ? timeout : fallback;
    }

    public int maxAttemptsOr(int fallback) {
        return maxAttempts > 0 ? maxAttempts : fallback;
    }
}
