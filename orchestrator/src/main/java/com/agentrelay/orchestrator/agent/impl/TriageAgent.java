package com.agentrelay.orchestrator.agent.impl;

import com.agentrelay.orchestrator.agent.AgentManifest;
import com.agentrelay.orchestrator.agent.AgentPolicy;
import com.agentrelay.orchestrator.agent.AgentPrompts;
import com.agentrelay.orchestrator.agent.LlmBackedAgent;
import com.agentrelay.orchestrator.llm.LlmClient;
import com.agentrelay.orchestrator.model.AgentState;
import com.agentrelay.orchestrator.quality.ContentType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Classifies the request. Its {@code requires_data} flag drives the
 * conditional data-analysis step of the default plan.
 */
@Component
public class TriageAgent extends LlmBackedAgent {

    public static final String KEY       = "triage";
    public static final String STATE_KEY = "triage_result";

    private static final AgentManifest MANIFEST = new AgentManifest(
            KEY, "1.0.0",
            "Classifies the request by category, priority and intent, and decides whether data analysis is needed.",
            STATE_KEY, ContentType.TRIAGE, false);

    public TriageAgent(LlmClient llm, AgentPrompts prompts, ObjectMapper objectMapper) {
        super(llm, prompts, objectMapper);
    }

    @Override public AgentManifest manifest() { return MANIFEST; }
    @Override public AgentPolicy   policy()   { return AgentPolicy.of(Duration.ofSeconds(30), 0); }

    @Override
    protected List<String> inputKeys() {
        return List.of();
    }

    /** {@code requires_data} is always a boolean, whatever the model wrote. */
    @Override
    protected Map<String, Object> postProcess(Map<String, Object> output, AgentState state) {
        Object flag = output.get("requires_data");
        output.put("requires_data", flag instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(flag)));
        output.putIfAbsent("priority", "medium");
        return output;
    }
}
