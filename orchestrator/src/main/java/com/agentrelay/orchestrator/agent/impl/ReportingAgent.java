package com.agentrelay.orchestrator.agent.impl;

import com.agentrelay.orchestrator.agent.AgentManifest;
import com.agentrelay.orchestrator.agent.AgentPrompts;
import com.agentrelay.orchestrator.agent.LlmBackedAgent;
import com.agentrelay.orchestrator.llm.LlmClient;
import com.agentrelay.orchestrator.quality.ContentType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Final stage: summarises every earlier stage's output for the user.
 */
@Component
public class ReportingAgent extends LlmBackedAgent {

    public static final String KEY       = "reporting";
    public static final String STATE_KEY = "report_result";

    private static final AgentManifest MANIFEST = new AgentManifest(
            KEY, "1.0.0",
            "Summarizes the findings, recommendations and next steps of the run.",
            STATE_KEY, ContentType.REPORT, true);

    public ReportingAgent(LlmClient llm, AgentPrompts prompts, ObjectMapper objectMapper) {
        super(llm, prompts, objectMapper);
    }

    @Override public AgentManifest manifest() { return MANIFEST; }

    @Override
    protected List<String> inputKeys() {
        return List.of(TriageAgent.STATE_KEY, DataAgent.STATE_KEY, OptimizationAgent.STATE_KEY,
                ActionsAgent.STATE_KEY, ValidationAgent.STATE_KEY);
    }
}
