package com.agentrelay.orchestrator.agent.impl;

import com.agentrelay.orchestrator.agent.AgentManifest;
import com.agentrelay.orchestrator.agent.AgentPrompts;
import com.agentrelay.orchestrator.agent.LlmBackedAgent;
import com.agentrelay.orchestrator.llm.LlmClient;
import com.agentrelay.orchestrator.quality.ContentType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class DataAgent extends LlmBackedAgent {

    public static final String KEY       = "data";
    public static final String STATE_KEY = "data_result";

    private static final AgentManifest MANIFEST = new AgentManifest(
            KEY, "1.0.0",
            "Analyzes workload usage and metrics and reports quantified findings.",
            STATE_KEY, ContentType.DATA_ANALYSIS, true);

    public DataAgent(LlmClient llm, AgentPrompts prompts, ObjectMapper objectMapper) {
        super(llm, prompts, objectMapper);
    }

    @Override public AgentManifest manifest() { return MANIFEST; }

    @Override
    protected List<String> inputKeys() {
        return List.of(TriageAgent.STATE_KEY);
    }
}
