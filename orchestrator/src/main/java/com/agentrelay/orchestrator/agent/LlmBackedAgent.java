package com.agentrelay.orchestrator.agent;

import com.agentrelay.orchestrator.llm.LlmClient;
import com.agentrelay.orchestrator.llm.ResponseParser;
import com.agentrelay.orchestrator.model.AgentState;
import com.agentrelay.orchestrator.model.ExecutionContext;
import com.agentrelay.orchestrator.model.ExecutionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for agents that answer with one LLM completion.
 *
 * <pre>
 *   prompt(request, prior outputs, quality feedback) → LLM → &lt;result&gt;{json}&lt;/result&gt;
 *     → parse → postProcess → state.with(stateKey, output)
 * </pre>
 *
 * A regeneration (context carrying {@code prompt_adjustments}) uses the
 * adjusted temperature.
 */
public abstract class LlmBackedAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(LlmBackedAgent.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final LlmClient    llm;
    private final AgentPrompts prompts;
    private final ObjectMapper json;

    protected LlmBackedAgent(LlmClient llm, AgentPrompts prompts, ObjectMapper objectMapper) {
        this.llm     = llm;
        this.prompts = prompts;
        this.json    = objectMapper;
    }

    /** Prior state entries this agent reads, in prompt order. */
    protected abstract List<String> inputKeys();

    /** Hook for normalising the parsed output. Default: unchanged. */
    protected Map<String, Object> postProcess(Map<String, Object> output, AgentState state) {
        return output;
    }

    @Override
    public AgentOutcome execute(ExecutionContext context, AgentState state) {
        String name = manifest().name();
        String system = prompts.systemPrompt(name);
        String user   = prompts.userPrompt(state, inputKeys(), context);

        String reply = llm.complete(system, user, temperature(context));
        Map<String, Object> output = postProcess(parse(name, reply), state);

        log.debug("Agent '{}' produced {} field(s) (retry={})", name, output.size(), context.retryCount());
        return new AgentOutcome(
                state.with(manifest().stateKey(), output),
                ExecutionResult.completed(name, output));
    }

    private Map<String, Object> parse(String name, String reply) {
        String body = ResponseParser.extractJsonObject(reply)
                .orElseThrow(() -> new AgentExecutionException(AgentExecutionException.Kind.PARSE_ERROR,
                        "Agent '" + name + "' reply contains no JSON object"));
        try {
            return new LinkedHashMap<>(json.readValue(body, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new AgentExecutionException(AgentExecutionException.Kind.PARSE_ERROR,
                    "Agent '" + name + "' returned invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static double temperature(ExecutionContext context) {
        Object t = context.promptAdjustments().get("temperature");
        return t instanceof Number n ? n.doubleValue() : LlmClient.DEFAULT_TEMPERATURE;
    }
}
