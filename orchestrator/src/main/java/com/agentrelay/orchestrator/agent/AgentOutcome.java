package com.agentrelay.orchestrator.agent;

import com.agentrelay.orchestrator.model.AgentState;
import com.agentrelay.orchestrator.model.ExecutionResult;

import java.util.Objects;

/** What an agent hands back: the state it produced and its result. */
public record AgentOutcome(AgentState state, ExecutionResult result) {

    public AgentOutcome {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(result, "result");
    }
}
