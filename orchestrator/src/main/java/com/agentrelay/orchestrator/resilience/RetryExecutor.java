package com.agentrelay.orchestrator.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * Retry-with-backoff around any no-argument operation.
 *
 * <pre>
 *   attempt 1 ── fail ── sleep(delay) ── attempt 2 ── fail ── sleep(delay*factor) ── attempt 3 ...
 * </pre>
 *
 * The last failure is rethrown unchanged once {@link RetryPolicy#maxAttempts()}
 * is exhausted. Failures rejected by {@link RetryPolicy#retryOn()} are rethrown
 * on the spot.
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private RetryExecutor() {}

    public static <T> T withRetry(RetryPolicy policy, Supplier<T> operation) {
        return withAttempts(policy, attempt -> operation.get());
    }

    /**
     * Variant whose operation receives the 1-based attempt number, so callers
     * can derive a fresh per-attempt context (e.g. an incremented retry counter).
     */
    public static <T> T withAttempts(RetryPolicy policy, IntFunction<T> operation) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return operation.apply(attempt);
            } catch (RuntimeException e) {
                last = e;
                if (!policy.retryOn().test(e)) {
                    throw e;
                }
                if (attempt == policy.maxAttempts()) {
                    break;
                }
                Duration pause = policy.delayAfter(attempt);
                log.warn("Attempt {}/{} failed ({}), retrying in {} ms",
                        attempt, policy.maxAttempts(), e.getMessage(), pause.toMillis());
                sleep(pause, e);
            }
        }
        throw last;
    }

    private static void sleep(Duration pause, RuntimeException pending) {
        if (pause.isZero()) return;
        try {
            Thread.sleep(pause.toMillis(), (int) (pause.toNanosPart() % 1_000_000));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            pending.addSuppressed(ie);
            throw pending;
        }
    }
}
