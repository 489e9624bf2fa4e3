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
 * Produces the optimization recommendations. Run as an iterative step in the
 * default plan: regenerated until its quality score converges.
 */
@Component
public class OptimizationAgent extends LlmBackedAgent {

    public static final String KEY       = "optimization";
    public static final String STATE_KEY = "optimizations_result";

    private static final AgentManifest MANIFEST = new AgentManifest(
            KEY, "1.0.0",
            "Recommends specific optimizations with the technique and the expected quantified impact.",
            STATE_KEY, ContentType.OPTIMIZATION, true);

    public OptimizationAgent(LlmClient llm, AgentPrompts prompts, ObjectMapper objectMapper) {
        super(llm, prompts, objectMapper);
    }

    @Override public AgentManifest manifest() { return MANIFEST; }

    @Override
    protected List<String> inputKeys() {
        return List.of(TriageAgent.STATE_KEY, DataAgent.STATE_KEY);
    }
}
