package com.agentrelay.orchestrator.service;

import com.agentrelay.orchestrator.agent.Agent;
import com.agentrelay.orchestrator.agent.AgentExecutionException;
import com.agentrelay.orchestrator.agent.AgentManifest;
import com.agentrelay.orchestrator.agent.AgentNotFoundException;
import com.agentrelay.orchestrator.agent.AgentOutcome;
import com.agentrelay.orchestrator.agent.AgentRegistry;
import com.agentrelay.orchestrator.event.StageEvent;
import com.agentrelay.orchestrator.event.StageEventType;
import com.agentrelay.orchestrator.event.StatusEventSink;
import com.agentrelay.orchestrator.model.AgentState;
import com.agentrelay.orchestrator.model.ExecutionContext;
import com.agentrelay.orchestrator.model.ExecutionPlan;
import com.agentrelay.orchestrator.model.ExecutionResult;
import com.agentrelay.orchestrator.model.PlanStep;
import com.agentrelay.orchestrator.model.RunRequest;
import com.agentrelay.orchestrator.model.RunResult;
import com.agentrelay.orchestrator.model.RunStatus;
import com.agentrelay.orchestrator.quality.QualityGateService;
import com.agentrelay.orchestrator.quality.ValidationResult;
import com.agentrelay.orchestrator.resilience.CircuitBreaker;
import com.agentrelay.orchestrator.resilience.CircuitBreakerRegistry;
import com.agentrelay.orchestrator.resilience.MdcPropagation;
import com.agentrelay.orchestrator.resilience.RetryExecutor;
import com.agentrelay.orchestrator.resilience.RetryPolicy;
import com.agentrelay.orchestrator.resilience.TimeoutExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The orchestration state machine.
 *
 * <p>{@link #routeToAgent} runs one stage:
 * <pre>
 *   registry lookup
 *     → retry( breaker( timeout( agent.execute ) ) )
 *     → quality gate, regenerating up to maxRegenerations times
 *     → merge the stage's output into the run state
 * </pre>
 *
 * <p>{@link #run} walks an {@link ExecutionPlan}. Steps are sequential; within
 * a step agents run solo, fanned out over the same state snapshot (merged in
 * plan order), behind a condition on an earlier output, or repeatedly until
 * their quality score converges.
 *
 * <p>A stage that fails after its retries is reported, not thrown; a failed
 * non-optional step ends the plan early. Earlier stages' outputs are never
 * dropped: the run comes back {@code degraded} rather than {@code failed} as
 * long as some stage produced output.
 */
public class Supervisor {

    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    public static final ExecutionPlan DEFAULT_PLAN = ExecutionPlan.builder()
            .then("triage")
            .when("triage_result", "requires_data", "data")
            .refine("optimization", 0.7, 3)
            .parallel("actions", "validation")
            .then("reporting")
            .build();

    private final AgentRegistry          registry;
    private final QualityGateService     qualityGate;
    private final CircuitBreakerRegistry breakers;
    private final TimeoutExecutor        timeouts;
    private final Executor               fanOutExecutor;
    private final AgentPool              agentPool;
    private final OrchestrationMetrics   metrics;
    private final ExecutionTracker       tracker;
    private final StatusEventSink        events;
    private final MeterRegistry          meterRegistry;
    private final SupervisorSettings     settings;

    public Supervisor(AgentRegistry registry,
                      QualityGateService qualityGate,
                      CircuitBreakerRegistry breakers,
                      TimeoutExecutor timeouts,
                      Executor fanOutExecutor,
                      AgentPool agentPool,
                      OrchestrationMetrics metrics,
                      ExecutionTracker tracker,
                      StatusEventSink events,
                      MeterRegistry meterRegistry,
                      SupervisorSettings settings) {
        this.registry       = registry;
        this.qualityGate    = qualityGate;
        this.breakers       = breakers;
        this.timeouts       = timeouts;
        this.fanOutExecutor = fanOutExecutor;
        this.agentPool      = agentPool;
        this.metrics        = metrics;
        this.tracker        = tracker;
        this.events         = events;
        this.meterRegistry  = meterRegistry;
        this.settings       = settings;
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    public RunResult run(RunRequest request) {
        return run(request, newContext(request));
    }

    public ExecutionContext newContext(RunRequest request) {
        return ExecutionContext.newRun(request.userId(), request.threadId(), request.metadata());
    }

    /**
     * Executes the request's plan (or {@link #DEFAULT_PLAN}) under {@code context}.
     *
     * @throws CapacityExceededException if no agent instance is available for the user
     */
    public RunResult run(RunRequest request, ExecutionContext context) {
        ExecutionPlan plan = request.plan() != null ? request.plan() : DEFAULT_PLAN;

        agentPool.getOrCreateAgent(request.userId());
        MDC.put("runId",  context.runId());
        MDC.put("userId", context.userId());
        Instant startedAt = Instant.now();
        AgentState state = AgentState.forRequest(request.message());
        List<ExecutionResult> results = new ArrayList<>();
        boolean halted = false;
        try {
            tracker.markRunning(context.runId(), context.userId());
            publish(StageEventType.RUN_STARTED, context, null, Map.of("steps", plan.steps().size()));
            log.info("Run started with {} step(s)", plan.steps().size());

            for (PlanStep step : plan.steps()) {
                StepResult stepResult = executeStep(step, state, context);
                state = stepResult.state();
                results.addAll(stepResult.results());
                if (stepResult.failed() && !step.optional()) {
                    log.warn("Step '{}' failed, remaining steps skipped", step.label());
                    halted = true;
                    break;
                }
            }
        } finally {
            agentPool.releaseAgent(request.userId());
        }

        try {
            RunStatus status = runStatus(results);
            RunResult result = new RunResult(context.runId(), status, state, results, startedAt, Instant.now());
            tracker.complete(result);
            meterRegistry.counter("agentrelay.runs", "status", status.value()).increment();

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("status", status.value());
            payload.put("stages", results.size());
            payload.put("halted", halted);
            publish(StageEventType.RUN_COMPLETED, context, null, payload);
            log.info("Run finished: status={} stages={} halted={}", status.value(), results.size(), halted);
            return result;
        } finally {
            MDC.remove("runId");
            MDC.remove("userId");
        }
    }

    static RunStatus runStatus(List<ExecutionResult> results) {
        if (results.stream().allMatch(ExecutionResult::isCompleted)) return RunStatus.COMPLETED;
        if (results.stream().anyMatch(ExecutionResult::success))    return RunStatus.DEGRADED;
        return RunStatus.FAILED;
    }

    // ------------------------------------------------------------------
    // Plan steps
    // ------------------------------------------------------------------

    private record StepResult(AgentState state, List<ExecutionResult> results, boolean failed) {
        static StepResult skipped(AgentState state) {
            return new StepResult(state, List.of(), false);
        }
    }

    private StepResult executeStep(PlanStep step, AgentState state, ExecutionContext context) {
        if (step instanceof PlanStep.Single single) {
            StageOutcome outcome = routeOrFail(state, context, single.agentKey());
            return new StepResult(outcome.state(), List.of(outcome.result()), !outcome.result().success());
        }
        if (step instanceof PlanStep.Parallel parallel) {
            return fanOut(parallel, state, context);
        }
        if (step instanceof PlanStep.Conditional conditional) {
            return branch(conditional, state, context);
        }
        if (step instanceof PlanStep.Iterative iterative) {
            return refine(iterative, state, context);
        }
        throw new IllegalArgumentException("Unsupported plan step: " + step.getClass().getSimpleName());
    }

    /**
     * All agents start from the same snapshot; outputs are merged in the
     * order listed, not in completion order. The step fails only if every
     * branch failed.
     */
    private StepResult fanOut(PlanStep.Parallel step, AgentState snapshot, ExecutionContext context) {
        List<CompletableFuture<StageOutcome>> futures = new ArrayList<>();
        for (String key : step.agentKeys()) {
            futures.add(CompletableFuture.supplyAsync(
                    MdcPropagation.wrap(() -> routeOrFail(snapshot, context, key)), fanOutExecutor));
        }

        AgentState merged = snapshot;
        List<ExecutionResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            StageOutcome outcome = futures.get(i).join();
            results.add(outcome.result());
            String ownerKey = stateKeyOf(step.agentKeys().get(i));
            merged = merged.mergeStage(outcome.state(), ownerKey);
        }
        boolean allFailed = results.stream().noneMatch(ExecutionResult::success);
        return new StepResult(merged, results, allFailed);
    }

    private StepResult branch(PlanStep.Conditional step, AgentState state, ExecutionContext context) {
        Object flag = state.getMap(step.sourceKey()).get(step.field());
        boolean condition = flag instanceof Boolean b ? b : "true".equalsIgnoreCase(String.valueOf(flag));
        String agentKey = condition ? step.whenTrue() : step.whenFalse();
        if (agentKey == null) {
            log.info("Step '{}' is {}, skipped", step.label(), condition);
            return StepResult.skipped(state);
        }
        StageOutcome outcome = routeOrFail(state, context, agentKey);
        return new StepResult(outcome.state(), List.of(outcome.result()), !outcome.result().success());
    }

    /**
     * Re-runs one agent until its {@code quality_score} reaches the threshold.
     * Each iteration replaces the agent's own state entry; only the last
     * iteration's result is reported.
     */
    private StepResult refine(PlanStep.Iterative step, AgentState state, ExecutionContext context) {
        AgentState current = state;
        ExecutionContext iterationContext = context;
        ExecutionResult last = null;
        int iteration = 0;
        while (iteration < step.maxIterations()) {
            iteration++;
            StageOutcome outcome = routeOrFail(current, iterationContext, step.agentKey());
            last = outcome.result();
            if (!last.success()) break;
            current = outcome.state();

            double score = last.metric("quality_score", 1.0);
            if (score >= step.threshold()) {
                log.info("'{}' converged after {} iteration(s) (score {})", step.agentKey(), iteration, score);
                break;
            }
            iterationContext = iterationContext.withPromptAdjustments(Map.of(
                    "additional_instructions", List.of(
                            "The previous answer scored %.2f; reach at least %.2f with more specific, quantified content."
                                    .formatted(score, step.threshold()))));
        }
        ExecutionResult reported = last.withMetric("iterations", iteration);
        return new StepResult(current, List.of(reported), !reported.success());
    }

    // ------------------------------------------------------------------
    // Single stage
    // ------------------------------------------------------------------

    /** {@link #routeToAgent}, with a registry miss reported as a failed stage. */
    private StageOutcome routeOrFail(AgentState state, ExecutionContext context, String agentKey) {
        try {
            return routeToAgent(state, context, agentKey);
        } catch (AgentNotFoundException e) {
            log.error("Stage '{}' cannot run: {}", agentKey, e.getMessage());
            metrics.recordFailure(0);
            publish(StageEventType.AGENT_FAILED, context, agentKey, Map.of("error", e.getMessage()));
            return new StageOutcome(state, ExecutionResult.failed(agentKey, e.getMessage()));
        }
    }

    /**
     * Runs one agent against {@code state} and merges its output.
     *
     * @return the merged state and the stage result; on failure the state is
     *         returned unchanged and the result has {@code success=false}
     * @throws AgentNotFoundException if {@code agentKey} is not registered
     */
    public StageOutcome routeToAgent(AgentState state, ExecutionContext context, String agentKey) {
        Agent agent = registry.get(agentKey);
        AgentManifest manifest = agent.manifest();

        String previousStage = MDC.get("stage");
        MDC.put("stage", agentKey);
        int stageIndex = tracker.stageStarted(context.runId(), agentKey);
        publish(StageEventType.AGENT_STARTED, context, agentKey, Map.of("retry_count", context.retryCount()));
        long start = System.nanoTime();
        try {
            ExecutionResult result;
            AgentState merged = state;
            try {
                Attempted attempted = executeWithResilience(agent, state, context, stageIndex);
                AgentOutcome outcome = attempted.outcome();
                if (outcome.result().success() && manifest.qualityGated()) {
                    outcome = applyQualityGate(agent, state, context, outcome, stageIndex);
                }
                result = outcome.result().withMetric("attempts", attempted.attempts());
                if (result.success()) {
                    merged = state.mergeStage(outcome.state(), manifest.stateKey());
                }
            } catch (RuntimeException e) {
                log.warn("Stage '{}' failed: {}", agentKey, e.getMessage());
                result = ExecutionResult.failed(agentKey, e.getMessage());
            }

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            result = result.withMetric("execution_time_ms", elapsedMs);
            if (result.success()) {
                metrics.recordSuccess(elapsedMs);
            } else {
                metrics.recordFailure(elapsedMs);
            }
            tracker.stageFinished(context.runId(), stageIndex, result);
            publishStageResult(context, agentKey, result);
            return new StageOutcome(merged, result);
        } finally {
            if (previousStage != null) MDC.put("stage", previousStage); else MDC.remove("stage");
            MDC.remove("attempt");
        }
    }

    private record Attempted(AgentOutcome outcome, int attempts) {}

    /** Carries an agent's {@code success=false} outcome through the retry and breaker layers. */
    private static final class UnsuccessfulResultException extends RuntimeException {
        private final transient AgentOutcome outcome;

        UnsuccessfulResultException(AgentOutcome outcome) {
            super("Agent '" + outcome.result().agentName() + "' reported failure: " + outcome.result().error());
            this.outcome = outcome;
        }
    }

    /**
     * retry( breaker( timeout( registry.execute ) ) ). Every attempt gets a
     * fresh context with an incremented retry counter. When the last attempt
     * ends with {@code success=false} that result is returned as is.
     */
    private Attempted executeWithResilience(Agent agent, AgentState state, ExecutionContext context,
                                            int stageIndex) {
        String agentKey = agent.manifest().name();
        RetryPolicy policy = new RetryPolicy(
                agent.policy().maxAttemptsOr(settings.maxAttempts()),
                settings.retryDelay(),
                settings.backoffFactor(),
                RetryPolicy.TRANSIENT);
        Duration timeout = agent.policy().timeoutOr(settings.stageTimeout());
        CircuitBreaker breaker = breakers.forName(agentKey);

        AtomicReference<ExecutionContext> current = new AtomicReference<>(context);
        AtomicInteger attempts = new AtomicInteger();
        try {
            AgentOutcome outcome = RetryExecutor.withAttempts(policy, attempt -> {
                attempts.set(attempt);
                tracker.heartbeat(context.runId(), stageIndex);
                MDC.put("attempt", String.valueOf(attempt));
                ExecutionContext attemptContext = attempt == 1
                        ? current.get()
                        : current.updateAndGet(ExecutionContext::nextRetry);
                return breaker.execute(() -> {
                    AgentOutcome out = timeouts.withTimeout(timeout, agentKey,
                            () -> registry.execute(agentKey, attemptContext, state));
                    if (!out.result().success()) {
                        throw new UnsuccessfulResultException(out);
                    }
                    return out;
                });
            });
            return new Attempted(outcome, attempts.get());
        } catch (UnsuccessfulResultException e) {
            return new Attempted(e.outcome, attempts.get());
        }
    }

    /**
     * Validates the agent's output; on failure regenerates with the gate's
     * prompt adjustments, keeping the best-scoring attempt. Still failing after
     * {@code maxRegenerations} → best attempt marked degraded.
     */
    private AgentOutcome applyQualityGate(Agent agent, AgentState state, ExecutionContext context,
                                          AgentOutcome first, int stageIndex) {
        AgentManifest manifest = agent.manifest();
        Map<String, Object> validationContext = Map.of("user_request", state.userRequest());

        AgentOutcome best = first;
        ValidationResult bestValidation = validate(agent, first, validationContext);
        ValidationResult latest = bestValidation;
        ExecutionContext regenerationContext = context;
        int regenerations = 0;

        while (!latest.passed() && latest.retrySuggested() && regenerations < settings.maxRegenerations()) {
            regenerations++;
            log.info("Output of '{}' scored {} ({}), regenerating {}/{}", manifest.name(),
                    latest.overallScore(), latest.metrics().qualityLevel().value(),
                    regenerations, settings.maxRegenerations());
            regenerationContext = regenerationContext.withPromptAdjustments(latest.retryPromptAdjustments());

            AgentOutcome candidate;
            try {
                candidate = executeWithResilience(agent, state, regenerationContext, stageIndex).outcome();
            } catch (RuntimeException e) {
                log.warn("Regeneration {} of '{}' failed: {}", regenerations, manifest.name(), e.getMessage());
                break;
            }
            if (!candidate.result().success()) break;

            latest = validate(agent, candidate, validationContext);
            if (latest.passed() || latest.overallScore() > bestValidation.overallScore()) {
                best = candidate;
                bestValidation = latest;
            }
        }

        ExecutionResult result = best.result()
                .withMetric("quality_score", bestValidation.overallScore())
                .withMetric("regenerations", regenerations);
        if (!bestValidation.passed()) {
            result = result.asDegraded("Quality below threshold after %d regeneration(s): score %.2f (%s)"
                    .formatted(regenerations, bestValidation.overallScore(),
                            bestValidation.metrics().qualityLevel().value()));
        }
        return new AgentOutcome(best.state(), result);
    }

    private ValidationResult validate(Agent agent, AgentOutcome outcome, Map<String, Object> context) {
        String content = agent.contentForValidation(outcome.result());
        return qualityGate.validateContent(content, agent.manifest().contentType(), context, false);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String stateKeyOf(String agentKey) {
        return registry.contains(agentKey) ? registry.get(agentKey).manifest().stateKey() : null;
    }

    private void publishStageResult(ExecutionContext context, String agentKey, ExecutionResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", result.status().value());
        payload.put("execution_time_ms", result.metric("execution_time_ms", 0));
        if (result.metrics().containsKey("quality_score")) {
            payload.put("quality_score", result.metrics().get("quality_score"));
        }
        if (result.error() != null) {
            payload.put("error", result.error());
        }
        StageEventType type = !result.success() ? StageEventType.AGENT_FAILED
                : result.isDegraded() ? StageEventType.AGENT_DEGRADED
                : StageEventType.AGENT_COMPLETED;
        publish(type, context, agentKey, payload);
    }

    private void publish(StageEventType type, ExecutionContext context, String agentKey,
                         Map<String, Object> payload) {
        try {
            events.publish(StageEvent.of(type, context.runId(), context.userId(), agentKey, payload));
        } catch (RuntimeException e) {
            log.warn("Status event {} could not be delivered: {}", type.value(), e.getMessage());
        }
    }
}
