package com.agentrelay.orchestrator.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Count-based circuit breaker.
 *
 * <p>Every failure that passes through {@link #execute} increments the failure
 * counter; reaching {@code failureThreshold} opens the breaker. While open,
 * calls are rejected with {@link CircuitBreakerOpenException} without touching
 * the operation. Once {@code recoveryTimeout} has elapsed, exactly one caller
 * is let through as a trial call: success closes the breaker and resets the counter,
 * failure re-opens it and restarts the timeout window. Other callers arriving
 * while the trial call is in flight are rejected.
 *
 * <p>State is guarded by the instance monitor; the operation itself runs
 * outside of it.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String   name;
    private final int      failureThreshold;
    private final Duration recoveryTimeout;

    private CircuitState state = CircuitState.CLOSED;
    private int  failureCount;
    private long openedAtNanos;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.name             = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout  = recoveryTimeout;
    }

    public <T> T execute(Supplier<T> operation) {
        boolean trial = admit();
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException | Error e) {
            onFailure(trial, e);
            throw e;
        }
        onSuccess(trial);
        return result;
    }

    private synchronized boolean admit() {
        switch (state) {
            case CLOSED:
                return false;
            case OPEN:
                if (System.nanoTime() - openedAtNanos >= recoveryTimeout.toNanos()) {
                    state = CircuitState.HALF_OPEN;
                    trialInFlight = true;
                    log.info("Circuit breaker '{}' half-open, admitting a trial call", name);
                    return true;
                }
                throw new CircuitBreakerOpenException(name);
            case HALF_OPEN:
            default:
                if (trialInFlight) {
                    throw new CircuitBreakerOpenException(name);
                }
                trialInFlight = true;
                return true;
        }
    }

    private synchronized void onSuccess(boolean trial) {
        if (trial || state != CircuitState.CLOSED) {
            log.info("Circuit breaker '{}' closed after successful trial call", name);
        }
        state = CircuitState.CLOSED;
        failureCount = 0;
        trialInFlight = false;
    }

    private synchronized void onFailure(boolean trial, Throwable error) {
        failureCount++;
        if (trial) {
            trialInFlight = false;
            trip("trial call failed: " + error.getMessage());
        } else if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
            trip(failureCount + " consecutive failures, last: " + error.getMessage());
        }
    }

    private void trip(String reason) {
        state = CircuitState.OPEN;
        openedAtNanos = System.nanoTime();
        log.warn("Circuit breaker '{}' OPEN for {} ms ({})", name, recoveryTimeout.toMillis(), reason);
    }

    /** Forces the breaker back to CLOSED with a zero failure count. */
    public synchronized void reset() {
        state = CircuitState.CLOSED;
        failureCount = 0;
        trialInFlight = false;
    }

    /**
     * Current state as callers would observe it; an OPEN breaker whose timeout
     * has elapsed is reported as HALF_OPEN.
     */
    public synchronized CircuitState state() {
        if (state == CircuitState.OPEN
                && System.nanoTime() - openedAtNanos >= recoveryTimeout.toNanos()) {
            return CircuitState.HALF_OPEN;
        }
        return state;
    }

    public synchronized int failureCount() { return failureCount; }

    public String   name()             { return name; }
    public int      failureThreshold() { return failureThreshold; }
    public Duration recoveryTimeout()  { return recoveryTimeout; }
}
