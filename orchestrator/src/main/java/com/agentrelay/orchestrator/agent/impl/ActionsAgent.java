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
public class ActionsAgent extends LlmBackedAgent {

    public static final String KEY       = "actions";
    public static final String STATE_KEY = "action_plan_result";

    private static final AgentManifest MANIFEST = new AgentManifest(
            KEY, "1.0.0",
            "Turns the recommendations into an ordered, verifiable action plan.",
            STATE_KEY, ContentType.ACTION_PLAN, true);

    public ActionsAgent(LlmClient llm, AgentPrompts prompts, ObjectMapper objectMapper) {
        super(llm, prompts, objectMapper);
    }

    @Override public AgentManifest manifest() { return MANIFEST; }

    @Override
    protected List<String> inputKeys() {
        return List.of(OptimizationAgent.STATE_KEY, DataAgent.STATE_KEY);
    }
}
