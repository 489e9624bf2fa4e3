package com.agentrelay.orchestrator.api.dto;

import com.agentrelay.orchestrator.model.ExecutionPlan;
import com.agentrelay.orchestrator.model.RunRequest;
import jakarta.validation.constraints.NotBlank;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /runs.
 *
 * Required: userId, message
 * Optional: threadId, metadata, plan (the default pipeline runs when absent)
 */
public record SubmitRunRequest(
        @NotBlank String      userId,
        String                threadId,
        @NotBlank String      message,
        Map<String, Object>   metadata,
        List<PlanStepRequest> plan
) {
    public RunRequest toRunRequest() {
        ExecutionPlan executionPlan = null;
        if (plan != null && !plan.isEmpty()) {
            ExecutionPlan.Builder builder = ExecutionPlan.builder();
            plan.forEach(step -> builder.step(step.toPlanStep()));
            executionPlan = builder.build();
        }
        return new RunRequest(userId, threadId, message, metadata, executionPlan);
    }
}
