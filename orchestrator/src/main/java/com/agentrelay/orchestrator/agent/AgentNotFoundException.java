package com.agentrelay.orchestrator.agent;

public class AgentNotFoundException extends RuntimeException {

    private final String agentKey;

    public AgentNotFoundException(String agentKey) {
        super("No agent registered with key: '" + agentKey + "'");
        this.agentKey = agentKey;
    }

    public String getAgentKey() { return agentKey; }
}
