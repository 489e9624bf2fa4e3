package com.agentrelay.orchestrator.agent;

import com.agentrelay.orchestrator.model.AgentState;
import com.agentrelay.orchestrator.model.ExecutionContext;
import com.agentrelay.orchestrator.model.ExecutionResult;
import com.agentrelay.orchestrator.quality.ContentType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentRegistryTest {

    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final ExecutionContext ctx = ExecutionContext.newRun("u", null, Map.of());
    private final AgentState state = AgentState.forRequest("req");

    private static Agent agent(String key, BiFunction<ExecutionContext, AgentState, AgentOutcome> body) {
        AgentManifest manifest = new AgentManifest(key, "1.0.0", key, key + "_result", ContentType.GENERAL, false);
        return new Agent() {
            @Override public AgentManifest manifest() { return manifest; }
            @Override public AgentOutcome execute(ExecutionContext c, AgentState s) { return body.apply(c, s); }
        };
    }

    private static Agent ok(String key) {
        return agent(key, (c, s) -> new AgentOutcome(s.with(key + "_result", "done"),
                ExecutionResult.completed(key, "done")));
    }

    private double calls(String agent, String status) {
        var counter = meters.find("agentrelay.agent.calls").tags("agent", agent, "status", status).counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    void constructor_duplicateKey_fails() {
        assertThatThrownBy(() -> new AgentRegistry(List.of(ok("a"), ok("a")), meters))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate agent key 'a'");
    }

    @Test
    void get_unknownOrNullKey_throwsNotFound() {
        AgentRegistry registry = new AgentRegistry(List.of(ok("a")), meters);

        assertThatThrownBy(() -> registry.get("b"))
                .isInstanceOf(AgentNotFoundException.class)
                .satisfies(e -> assertThat(((AgentNotFoundException) e).getAgentKey()).isEqualTo("b"));
        assertThatThrownBy(() -> registry.get(null)).isInstanceOf(AgentNotFoundException.class);
        assertThat(registry.contains("a")).isTrue();
        assertThat(registry.contains(null)).isFalse();
    }

    @Test
    void agentKeysAndCapabilities_areSorted() {
        AgentRegistry registry = new AgentRegistry(List.of(ok("zeta"), ok("alpha"), ok("mid")), meters);

        assertThat(registry.agentKeys()).containsExactly("alpha", "mid", "zeta");
        assertThat(registry.describeCapabilities()).extracting(AgentManifest::name)
                .containsExactly("alpha", "mid", "zeta");
    }

    @Test
    void execute_success_countsAndTimes() {
        AgentRegistry registry = new AgentRegistry(List.of(ok("a")), meters);

        AgentOutcome outcome = registry.execute("a", ctx, state);

        assertThat(outcome.state().get("a_result")).contains("done");
        assertThat(calls("a", "success")).isEqualTo(1.0);
        assertThat(meters.find("agentrelay.agent.duration").tag("agent", "a").timer().count()).isEqualTo(1);
    }

    @Test
    void execute_unsuccessfulResult_countedAsFailed() {
        AgentRegistry registry = new AgentRegistry(List.of(
                agent("a", (c, s) -> new AgentOutcome(s, ExecutionResult.failed("a", "nope")))), meters);

        assertThat(registry.execute("a", ctx, state).result().success()).isFalse();
        assertThat(calls("a", "failed")).isEqualTo(1.0);
    }

    @Test
    void execute_unexpectedException_wrappedAsExecutionError() {
        AgentRegistry registry = new AgentRegistry(List.of(
                agent("a", (c, s) -> { throw new IllegalArgumentException("bad input"); })), meters);

        assertThatThrownBy(() -> registry.execute("a", ctx, state))
                .isInstanceOf(AgentExecutionException.class)
                .hasMessageContaining("bad input")
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(calls("a", "error")).isEqualTo(1.0);
    }

    @Test
    void execute_agentExecutionException_keepsKindAsStatus() {
        AgentRegistry registry = new AgentRegistry(List.of(
                agent("a", (c, s) -> {
                    throw new AgentExecutionException(AgentExecutionException.Kind.PARSE_ERROR, "garbled");
                })), meters);

        assertThatThrownBy(() -> registry.execute("a", ctx, state))
                .isInstanceOf(AgentExecutionException.class);
        assertThat(calls("a", "parse_error")).isEqualTo(1.0);
    }

    @Test
    void execute_nullOutcome_isExecutionError() {
        AgentRegistry registry = new AgentRegistry(List.of(agent("a", (c, s) -> null)), meters);

        assertThatThrownBy(() -> registry.execute("a", ctx, state))
                .isInstanceOf(AgentExecutionException.class)
                .hasMessageContaining("returned no outcome");
        assertThat(calls("a", "execution_error")).isEqualTo(1.0);
    }
}
