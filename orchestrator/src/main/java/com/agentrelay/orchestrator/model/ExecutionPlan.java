package com.agentrelay.orchestrator.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of plan steps executed by the supervisor for one run.
 */
public record ExecutionPlan(List<PlanStep> steps) {

    public ExecutionPlan {
        steps = List.copyOf(steps);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<PlanStep> steps = new ArrayList<>();

        public Builder then(String agentKey) {
            steps.add(new PlanStep.Single(agentKey));
            return this;
        }

        public Builder parallel(String... agentKeys) {
            steps.add(new PlanStep.Parallel(List.of(agentKeys)));
            return this;
        }

        public Builder when(String sourceKey, String field, String agentKey) {
            steps.add(new PlanStep.Conditional(sourceKey, field, agentKey));
            return this;
        }

        public Builder refine(String agentKey, double threshold, int maxIterations) {
            steps.add(new PlanStep.Iterative(agentKey, threshold, maxIterations));
            return this;
        }

        public Builder step(PlanStep step) {
            steps.add(step);
            return this;
        }

        public ExecutionPlan build() {
            return new ExecutionPlan(steps);
        }
    }
}
