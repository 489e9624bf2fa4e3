package com.agentrelay.orchestrator.service;

import com.agentrelay.orchestrator.model.ExecutionContext;
import com.agentrelay.orchestrator.model.RunRequest;
import com.agentrelay.orchestrator.model.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;

/**
 * Accepts runs and drives them on a fixed worker pool.
 *
 * A submitted run is registered with the {@link ExecutionTracker} before it is
 * queued, so it can be polled immediately. The pool size caps how many runs
 * (and therefore concurrent LLM conversations) are in flight.
 */
public class RunScheduler {

    private static final Logger log = LoggerFactory.getLogger(RunScheduler.class);

    private final Supervisor       supervisor;
    private final AgentPool        agentPool;
    private final ExecutionTracker tracker;
    private final ExecutorService  workers;

    public RunScheduler(Supervisor supervisor, AgentPool agentPool,
                        ExecutionTracker tracker, ExecutorService workers) {
        this.supervisor = supervisor;
        this.agentPool  = agentPool;
        this.tracker    = tracker;
        this.workers    = workers;
    }

    /**
     * Queues a run and returns its (pending) record.
     *
     * @throws CapacityExceededException if the agent pool cannot take the user right now
     */
    public RunRecord submit(RunRequest request) {
        if (!agentPool.hasCapacityFor(request.userId())) {
            throw new CapacityExceededException(agentPool.maxConcurrent());
        }
        ExecutionContext context = supervisor.newContext(request);
        RunRecord record = tracker.register(context.runId(), context.userId());

        workers.submit(() -> {
            try {
                supervisor.run(request, context);
            } catch (Exception e) {
                log.error("Run {} aborted: {}", context.runId(), e.getMessage(), e);
                tracker.fail(context.runId(), e.getMessage());
            }
        });
        log.info("Run {} queued for user {}", context.runId(), request.userId());
        return record;
    }

    /**
     * Runs on the caller's thread and returns the final result. A run that
     * aborts is marked failed before the exception propagates.
     *
     * @throws CapacityExceededException if the agent pool cannot take the user right now
     */
    public RunResult runSync(RunRequest request) {
        if (!agentPool.hasCapacityFor(request.userId())) {
            throw new CapacityExceededException(agentPool.maxConcurrent());
        }
        ExecutionContext context = supervisor.newContext(request);
        tracker.register(context.runId(), context.userId());
        try {
            return supervisor.run(request, context);
        } catch (RuntimeException e) {
            log.error("Run {} aborted: {}", context.runId(), e.getMessage(), e);
            tracker.fail(context.runId(), e.getMessage());
            throw e;
        }
    }
}
