package com.agentrelay.orchestrator.api.dto;

import com.agentrelay.orchestrator.model.PlanStep;

import java.util.List;

/**
 * One step of a caller-supplied plan.
 *
 * <pre>
 *   {"type":"single",      "agent":"triage"}
 *   {"type":"parallel",    "agents":["actions","validation"]}
 *   {"type":"conditional", "sourceKey":"triage_result", "field":"requires_data", "whenTrue":"data"}
 *   {"type":"iterative",   "agent":"optimization", "threshold":0.7, "maxIterations":3}
 * </pre>
 */
public record PlanStepRequest(
        String       type,
        String       agent,
        List<String> agents,
        String       sourceKey,
        String       field,
        String       whenTrue,
        String       whenFalse,
        Double       threshold,
        Integer      maxIterations,
        boolean      optional
) {
    /** @throws IllegalArgumentException for an unknown type or missing fields */
    public PlanStep toPlanStep() {
        String kind = type == null ? "single" : type;
        return switch (kind) {
            case "single" -> new PlanStep.Single(require(agent, "agent"), optional);
            case "parallel" -> {
                if (agents == null || agents.isEmpty()) {
                    throw new IllegalArgumentException("parallel step needs 'agents'");
                }
                yield new PlanStep.Parallel(agents, optional);
            }
            case "conditional" -> new PlanStep.Conditional(
                    require(sourceKey, "sourceKey"), require(field, "field"), whenTrue, whenFalse, optional);
            case "iterative" -> new PlanStep.Iterative(
                    require(agent, "agent"),
                    threshold != null ? threshold : 0.7,
                    maxIterations != null ? maxIterations : 3,
                    optional);
            default -> throw new IllegalArgumentException("Unknown plan step type: " + kind);
        };
    }

    private static String require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("plan step field '" + name + "' is required");
        }
        return value;
    }
}
