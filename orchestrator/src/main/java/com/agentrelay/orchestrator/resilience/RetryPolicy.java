package com.agentrelay.orchestrator.resilience;

import com.agentrelay.orchestrator.agent.AgentNotFoundException;
import com.agentrelay.orchestrator.llm.LlmException;
import com.agentrelay.orchestrator.service.CapacityExceededException;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Retry parameters consumed by {@link RetryExecutor}.
 *
 * @param maxAttempts   total number of tries, including the first one (≥ 1)
 * @param delay         sleep before the second attempt
 * @param backoffFactor multiplier applied per attempt: the sleep before attempt
 *                      {@code n+1} is {@code delay * backoffFactor^(n-1)}
 * @param retryOn       decides whether a failure is worth another attempt
 */
public record RetryPolicy(
        int                  maxAttempts,
        Duration             delay,
        double               backoffFactor,
        Predicate<Throwable> retryOn) {

    /**
     * Failures that must surface immediately: a registry miss, a full agent pool,
     * an open circuit and a rejected API call will not heal within a backoff window.
     */
    public static final Predicate<Throwable> TRANSIENT = e -> {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof CircuitBreakerOpenException
                    || t instanceof AgentNotFoundException
                    || t instanceof CapacityExceededException
                    || (t instanceof LlmException le && !le.isRetryable())) {
                return false;
            }
            if (t.getCause() == t) break;
        }
        return true;
    };

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1.0, got " + backoffFactor);
        }
        if (delay == null || delay.isNegative()) delay = Duration.ZERO;
        if (retryOn == null) retryOn = TRANSIENT;
    }

    public static RetryPolicy of(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay, 1.0, TRANSIENT);
    }

    public static RetryPolicy of(int maxAttempts, Duration delay, double backoffFactor) {
        return new RetryPolicy(maxAttempts, delay, backoffFactor, TRANSIENT);
    }

    /** A single attempt, no retry. */
    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, TRANSIENT);
    }

    /** Sleep before attempt {@code attempt + 1}, where {@code attempt} is 1-based. */
    public Duration delayAfter(int attempt) {
        double factor = Math.pow(backoffFactor, Math.max(0, attempt - 1));
        return Duration.ofNanos((long) (delay.toNanos() * factor));
    }
}
