package com.agentrelay.orchestrator.agent.impl;

import com.agentrelay.orchestrator.agent.Agent;
import com.agentrelay.orchestrator.agent.AgentManifest;
import com.agentrelay.orchestrator.agent.AgentOutcome;
import com.agentrelay.orchestrator.agent.AgentOutputs;
import com.agentrelay.orchestrator.agent.AgentPolicy;
import com.agentrelay.orchestrator.model.AgentState;
import com.agentrelay.orchestrator.model.ExecutionContext;
import com.agentrelay.orchestrator.model.ExecutionResult;
import com.agentrelay.orchestrator.quality.ContentType;
import com.agentrelay.orchestrator.quality.QualityGateService;
import com.agentrelay.orchestrator.quality.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs in the orchestrator JVM: re-validates the earlier stages' outputs in
 * strict mode and records the verdict per stage. No LLM call.
 */
@Component
public class ValidationAgent implements Agent {

    public static final String KEY       = "validation";
    public static final String STATE_KEY = "validation_result";

    private static final AgentManifest MANIFEST = new AgentManifest(
            KEY, "1.0.0",
            "Checks the data analysis and optimization outputs against the strict quality bar.",
            STATE_KEY, ContentType.GENERAL, false);

    private record Target(String stateKey, ContentType contentType) {}

    private static final List<Target> TARGETS = List.of(
            new Target(DataAgent.STATE_KEY, ContentType.DATA_ANALYSIS),
            new Target(OptimizationAgent.STATE_KEY, ContentType.OPTIMIZATION));

    private final QualityGateService qualityGate;

    public ValidationAgent(QualityGateService qualityGate) {
        this.qualityGate = qualityGate;
    }

    @Override public AgentManifest manifest() { return MANIFEST; }
    @Override public AgentPolicy   policy()   { return AgentPolicy.javaLocal(); }

    @Override
    public AgentOutcome execute(ExecutionContext context, AgentState state) {
        Map<String, Object> checks = new LinkedHashMap<>();
        boolean allPassed = true;
        for (Target target : TARGETS) {
            if (!state.contains(target.stateKey())) continue;
            String content = AgentOutputs.toText(state.get(target.stateKey()).orElse(null));
            ValidationResult v = qualityGate.validateContent(content, target.contentType(),
                    Map.of("user_request", state.userRequest()), true);
            allPassed &= v.passed();

            Map<String, Object> check = new LinkedHashMap<>();
            check.put("passed", v.passed());
            check.put("overall_score", v.overallScore());
            check.put("quality_level", v.metrics().qualityLevel().value());
            check.put("issues", v.metrics().issues());
            checks.put(target.stateKey(), check);
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("checks", checks);
        output.put("all_passed", allPassed);
        return new AgentOutcome(state.with(STATE_KEY, output), ExecutionResult.completed(KEY, output));
    }
}
