package com.agentrelay.orchestrator.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one stage invocation. Produced once and never mutated; the
 * {@code with*} methods return copies.
 *
 * @param metrics numeric measurements, e.g. {@code execution_time_ms},
 *                {@code quality_score}, {@code attempts}
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExecutionResult(
        boolean             success,
        ExecutionStatus     status,
        Object              result,
        String              error,
        String              agentName,
        Map<String, Double> metrics) {

    public ExecutionResult {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public static ExecutionResult completed(String agentName, Object result) {
        return new ExecutionResult(true, ExecutionStatus.COMPLETED, result, null, agentName, Map.of());
    }

    public static ExecutionResult failed(String agentName, String error) {
        return new ExecutionResult(false, ExecutionStatus.FAILED, null, error, agentName, Map.of());
    }

    public ExecutionResult withMetric(String name, double value) {
        Map<String, Double> next = new LinkedHashMap<>(metrics);
        next.put(name, value);
        return new ExecutionResult(success, status, result, error, agentName, next);
    }

    /** Marks the result degraded: still successful, but below the quality bar. */
    public ExecutionResult asDegraded(String reason) {
        return new ExecutionResult(true, ExecutionStatus.DEGRADED, result, reason, agentName, metrics);
    }

    public boolean isCompleted() { return status == ExecutionStatus.COMPLETED; }
    public boolean isDegraded()  { return status == ExecutionStatus.DEGRADED; }

    public double metric(String name, double fallback) {
        Double v = metrics.get(name);
        return v != null ? v : fallback;
    }
}
