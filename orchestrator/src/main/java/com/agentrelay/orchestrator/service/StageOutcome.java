package com.agentrelay.orchestrator.service;

import com.agentrelay.orchestrator.model.AgentState;
import com.agentrelay.orchestrator.model.ExecutionResult;

/**
 * Result of routing one stage: the run state after merging the stage's
 * output (unchanged when the stage failed) and the stage's result.
 */
public record StageOutcome(AgentState state, ExecutionResult result) {}
