package com.agentrelay.orchestrator.resilience;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs an operation on a worker thread and waits for it at most {@code duration}.
 *
 * On overrun the worker future is cancelled (interrupting the task) and a
 * {@link ServiceTimeoutException} carrying the label is thrown. Failures of
 * the operation itself are rethrown unwrapped.
 */
public class TimeoutExecutor {

    private final ExecutorService workers;

    public TimeoutExecutor(ExecutorService workers) {
        this.workers = workers;
    }

    public <T> T withTimeout(Duration duration, String label, Supplier<T> operation) {
        Supplier<T> task = MdcPropagation.wrap(operation);
        Future<T> future = workers.submit(task::get);
        try {
            return future.get(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ServiceTimeoutException(label, duration);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("'" + label + "' failed", cause);
        } catch (CancellationException e) {
            throw new ServiceTimeoutException(label, duration);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ServiceTimeoutException(label, duration);
        }
    }
}
