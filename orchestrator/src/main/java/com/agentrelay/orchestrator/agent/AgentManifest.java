package com.agentrelay.orchestrator.agent;

import com.agentrelay.orchestrator.quality.ContentType;

/**
 * Identity and routing metadata for an agent.
 *
 * @param name         registry key used in execution plans, e.g. "triage"
 * @param version      semantic version of the agent's prompt/contract
 * @param description  one sentence, shown in the capability listing
 * @param stateKey     the {@code AgentState} entry this agent writes, e.g. "triage_result"
 * @param contentType  how the quality gate scores this agent's output
 * @param qualityGated whether the supervisor validates the output and regenerates on failure
 */
public record AgentManifest(
        String      name,
        String      version,
        String      description,
        String      stateKey,
        ContentType contentType,
        boolean     qualityGated) {}
