package com.agentrelay.orchestrator.agent;

import com.agentrelay.orchestrator.model.AgentState;
import com.agentrelay.orchestrator.model.ExecutionContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * System and user prompts for the LLM-backed agents.
 *
 * <p>Every system prompt tells the model:
 * <ol>
 *   <li>what role it plays in the pipeline,</li>
 *   <li>the JSON shape of its answer,</li>
 *   <li>to wrap that answer in {@code <result>...</result>}.</li>
 * </ol>
 * The user prompt carries the request, the prior stages' outputs the agent
 * depends on and, on a regeneration, the quality gate's feedback.
 */
@Component
public class AgentPrompts {

    private static final String RESULT_RULES = """

            RULES:
              - Answer with a single JSON object inside <result>...</result> tags.
              - Use concrete numbers with units wherever the input allows it.
              - Do not invent measurements that are not supported by the input.
            """;

    private static final Map<String, String> SYSTEM_PROMPTS = Map.of(
            "triage", """
                    You are the Triage agent of an AI workload optimization assistant.

                    YOUR GOAL: classify the user's request so the next agents know what to do.

                    OUTPUT (JSON):
                      {"category": "cost|latency|throughput|quality|general",
                       "priority": "high|medium|low",
                       "intent": "<one sentence>",
                       "requires_data": true|false,
                       "key_parameters": {"<name>": "<value>"},
                       "summary": "<one or two sentences>"}

                    Set requires_data to true when the request refers to usage, metrics or
                    logs that must be analyzed before recommending anything.
                    """ + RESULT_RULES,
            "data", """
                    You are the Data Analysis agent of an AI workload optimization assistant.

                    YOUR GOAL: analyze the workload described in the request and the triage
                    result, and report the figures the optimization agent will need.

                    OUTPUT (JSON):
                      {"findings": ["<finding with numbers>", ...],
                       "metrics": {"<metric>": "<value with unit>"},
                       "conclusion": "<what the data indicates>"}
                    """ + RESULT_RULES,
            "optimization", """
                    You are the Optimization agent of an AI workload optimization assistant.

                    YOUR GOAL: recommend specific optimizations for the workload, each with the
                    technique, how to apply it and the expected impact.

                    OUTPUT (JSON):
                      {"recommendations": [
                          {"title": "<short>",
                           "description": "<what to change and how, with values>",
                           "expected_impact": "<e.g. latency from 800ms to 450ms (44%)>"}],
                       "summary": "<one paragraph>"}
                    """ + RESULT_RULES,
            "actions", """
                    You are the Actions agent of an AI workload optimization assistant.

                    YOUR GOAL: turn the recommended optimizations into an ordered action plan.

                    OUTPUT (JSON):
                      {"steps": ["1. <imperative step with command or setting>", ...],
                       "verification": "<how to measure that the change worked>",
                       "rollback": "<how to undo it>"}
                    """ + RESULT_RULES,
            "reporting", """
                    You are the Reporting agent of an AI workload optimization assistant.

                    YOUR GOAL: summarize the whole analysis for the user.

                    OUTPUT (JSON):
                      {"summary": "<two or three sentences with the key numbers>",
                       "findings": ["<finding>", ...],
                       "recommendations": ["<recommendation>", ...],
                       "next_steps": ["<step>", ...]}
                    """ + RESULT_RULES);

    private final ObjectMapper json;

    public AgentPrompts(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public String systemPrompt(String agentKey) {
        String prompt = SYSTEM_PROMPTS.get(agentKey);
        if (prompt == null) {
            throw new AgentNotFoundException(agentKey);
        }
        return prompt;
    }

    /**
     * @param inputKeys state entries to include, in order; absent ones are skipped
     */
    public String userPrompt(AgentState state, List<String> inputKeys, ExecutionContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("USER REQUEST:\n").append(state.userRequest()).append("\n");

        for (String key : inputKeys) {
            state.get(key).ifPresent(value ->
                    sb.append("\n").append(key.toUpperCase()).append(":\n").append(render(value)).append("\n"));
        }

        List<String> instructions = context.additionalInstructions();
        if (!instructions.isEmpty()) {
            sb.append("\nYOUR PREVIOUS ANSWER DID NOT MEET THE QUALITY BAR. Fix the following:\n");
            instructions.forEach(i -> sb.append("  - ").append(i).append("\n"));
            Object avoid = context.promptAdjustments().get("avoid_phrases");
            if (avoid instanceof List<?> phrases && !phrases.isEmpty()) {
                sb.append("Do not use these phrases: ").append(phrases).append("\n");
            }
        }
        return sb.toString();
    }

    private String render(Object value) {
        try {
            return json.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
