package com.agentrelay.orchestrator.agent;

import com.agentrelay.orchestrator.agent.impl.DataAgent;
import com.agentrelay.orchestrator.agent.impl.TriageAgent;
import com.agentrelay.orchestrator.llm.LlmClient;
import com.agentrelay.orchestrator.model.AgentState;
import com.agentrelay.orchestrator.model.ExecutionContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * LLM-backed agents against a mocked {@link LlmClient}.
 */
@ExtendWith(MockitoExtension.class)
class LlmBackedAgentTest {

    @Mock LlmClient llm;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AgentPrompts prompts;
    private ExecutionContext ctx;

    @BeforeEach
    void setUp() {
        prompts = new AgentPrompts(objectMapper);
        ctx = ExecutionContext.newRun("user-1", null, Map.of());
    }

    @Test
    void execute_parsesResultTagIntoStateEntry() {
        when(llm.complete(anyString(), anyString(), anyDouble())).thenReturn("""
                <result>{"category": "cost", "priority": "high", "requires_data": true}</result>
                """);
        TriageAgent agent = new TriageAgent(llm, prompts, objectMapper);

        AgentOutcome outcome = agent.execute(ctx, AgentState.forRequest("Cut my GPU bill"));

        assertThat(outcome.result().success()).isTrue();
        assertThat(outcome.state().getMap(TriageAgent.STATE_KEY))
                .containsEntry("category", "cost")
                .containsEntry("requires_data", true);
    }

    @Test
    void triage_postProcess_coercesFlagAndDefaultsPriority() {
        when(llm.complete(anyString(), anyString(), anyDouble()))
                .thenReturn("{\"category\": \"latency\", \"requires_data\": \"true\"}");
        TriageAgent agent = new TriageAgent(llm, prompts, objectMapper);

        Map<String, Object> out = agent.execute(ctx, AgentState.forRequest("p99 is 2s")).state()
                .getMap(TriageAgent.STATE_KEY);

        assertThat(out).containsEntry("requires_data", Boolean.TRUE).containsEntry("priority", "medium");
    }

    @Test
    void execute_replyWithoutJson_throwsParseError() {
        when(llm.complete(anyString(), anyString(), anyDouble())).thenReturn("I am not sure.");
        TriageAgent agent = new TriageAgent(llm, prompts, objectMapper);

        assertThatThrownBy(() -> agent.execute(ctx, AgentState.forRequest("hi")))
                .isInstanceOf(AgentExecutionException.class)
                .satisfies(e -> assertThat(((AgentExecutionException) e).getKind())
                        .isEqualTo(AgentExecutionException.Kind.PARSE_ERROR));
    }

    @Test
    void execute_invalidJson_throwsParseError() {
        when(llm.complete(anyString(), anyString(), anyDouble())).thenReturn("<result>{\"a\": }</result>");
        TriageAgent agent = new TriageAgent(llm, prompts, objectMapper);

        assertThatThrownBy(() -> agent.execute(ctx, AgentState.forRequest("hi")))
                .isInstanceOf(AgentExecutionException.class)
                .hasMessageContaining("invalid JSON");
    }

    @Test
    void execute_regeneration_usesAdjustedTemperatureAndFeedback() {
        when(llm.complete(anyString(), anyString(), anyDouble())).thenReturn("{\"findings\": []}");
        DataAgent agent = new DataAgent(llm, prompts, objectMapper);
        ExecutionContext regen = ctx.withPromptAdjustments(Map.of(
                "temperature", 0.3,
                "additional_instructions", List.of("Add concrete numbers"),
                "avoid_phrases", List.of("generally speaking")));

        agent.execute(regen, AgentState.forRequest("analyze usage"));

        ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
        verify(llm).complete(eq(prompts.systemPrompt(DataAgent.KEY)), userPrompt.capture(), eq(0.3));
        assertThat(userPrompt.getValue())
                .contains("DID NOT MEET THE QUALITY BAR")
                .contains("Add concrete numbers")
                .contains("generally speaking");
    }

    @Test
    void execute_firstAttempt_usesDefaultTemperature() {
        when(llm.complete(anyString(), anyString(), anyDouble())).thenReturn("{}");
        new TriageAgent(llm, prompts, objectMapper).execute(ctx, AgentState.forRequest("hi"));

        verify(llm).complete(anyString(), anyString(), eq(LlmClient.DEFAULT_TEMPERATURE));
    }

    @Test
    void userPrompt_includesPresentInputsInOrderAndSkipsMissing() {
        AgentState state = AgentState.forRequest("reduce cost")
                .with(TriageAgent.STATE_KEY, Map.of("category", "cost"));

        String prompt = prompts.userPrompt(state, List.of(TriageAgent.STATE_KEY, DataAgent.STATE_KEY), ctx);

        assertThat(prompt).startsWith("USER REQUEST:\nreduce cost")
                .contains("TRIAGE_RESULT:")
                .contains("\"category\" : \"cost\"")
                .doesNotContain(DataAgent.STATE_KEY.toUpperCase())
                .doesNotContain("QUALITY BAR");
    }

    @Test
    void systemPrompt_unknownAgent_throwsNotFound() {
        assertThatThrownBy(() -> prompts.systemPrompt("nope"))
                .isInstanceOf(AgentNotFoundException.class);
    }
}
