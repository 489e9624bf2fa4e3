package com.agentrelay.orchestrator.agent;

import com.agentrelay.orchestrator.model.AgentState;
import com.agentrelay.orchestrator.model.ExecutionContext;
import com.agentrelay.orchestrator.model.ExecutionResult;

/**
 * A single-responsibility task executor (triage, data analysis, optimization,
 * reporting, validation, ...).
 *
 * <p>Agents are Spring {@code @Component}s collected by {@link AgentRegistry}
 * and looked up by {@link AgentManifest#name()}. The supervisor owns the run
 * state: an agent reads the entries it needs from {@code state} and returns a
 * new state carrying its own output under {@link AgentManifest#stateKey()}.
 *
 * <p>Failures surface either as an exception (retried by the supervisor) or as
 * an {@link ExecutionResult} with {@code success=false}.
 */
public interface Agent {

    AgentManifest manifest();

    /** Per-agent overrides of the configured timeout and retry defaults. */
    default AgentPolicy policy() {
        return AgentPolicy.defaults();
    }

    /**
     * @throws AgentExecutionException on a controlled failure
     */
    AgentOutcome execute(ExecutionContext context, AgentState state);

    /**
     * Text the quality gate scores for this agent's result. Defaults to the
     * flattened text of the result payload.
     */
    default String contentForValidation(ExecutionResult result) {
        return AgentOutputs.toText(result.result());
    }
}
