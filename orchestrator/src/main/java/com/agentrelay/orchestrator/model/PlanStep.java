package com.agentrelay.orchestrator.model;

import java.util.List;

/**
 * One step of an {@link ExecutionPlan}. The supervisor dispatches on the
 * concrete record type.
 */
public interface PlanStep {

    /**
     * When true, a failure of this step is recorded but does not halt the plan.
     */
    boolean optional();

    /** Human-readable label used in logs and stage events. */
    String label();

    /** Run one agent against the current state. */
    record Single(String agentKey, boolean optional) implements PlanStep {
        public Single(String agentKey) { this(agentKey, false); }
        @Override public String label() { return agentKey; }
    }

    /**
     * Run several agents concurrently against the same snapshot; outputs are
     * merged in the order listed here.
     */
    record Parallel(List<String> agentKeys, boolean optional) implements PlanStep {
        public Parallel {
            agentKeys = List.copyOf(agentKeys);
            if (agentKeys.isEmpty()) throw new IllegalArgumentException("Parallel step needs at least one agent");
        }
        public Parallel(List<String> agentKeys) { this(agentKeys, false); }
        @Override public String label() { return "parallel" + agentKeys; }
    }

    /**
     * Pick an agent based on a boolean field of an earlier stage's output.
     * {@code whenFalse} may be null, in which case the step is skipped.
     */
    record Conditional(String sourceKey, String field, String whenTrue, String whenFalse,
                       boolean optional) implements PlanStep {
        public Conditional(String sourceKey, String field, String whenTrue) {
            this(sourceKey, field, whenTrue, null, false);
        }
        @Override public String label() { return "if " + sourceKey + "." + field; }
    }

    /**
     * Re-run one agent until its {@code quality_score} reaches {@code threshold}
     * or {@code maxIterations} runs have happened.
     */
    record Iterative(String agentKey, double threshold, int maxIterations,
                     boolean optional) implements PlanStep {
        public Iterative {
            if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
        }
        public Iterative(String agentKey, double threshold, int maxIterations) {
            this(agentKey, threshold, maxIterations, false);
        }
        @Override public String label() { return "refine " + agentKey; }
    }
}
