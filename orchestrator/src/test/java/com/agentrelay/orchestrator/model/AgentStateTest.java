package com.agentrelay.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AgentStateTest {

    @Test
    void with_returnsNewStateAndLeavesReceiverUntouched() {
        AgentState base = AgentState.forRequest("cut GPU cost");
        AgentState next = base.with("triage_result", Map.of("category", "optimization"));

        assertThat(base.keys()).containsExactly("user_request");
        assertThat(next.keys()).containsExactly("user_request", "triage_result");
        assertThat(next.userRequest()).isEqualTo("cut GPU cost");
    }

    @Test
    void mergeStage_addsNewKeysAndKeepsEarlierEntries() {
        AgentState run = AgentState.forRequest("q").with("a", 1);
        AgentState produced = run.with("b", 2);

        AgentState merged = run.mergeStage(produced, "b");

        assertThat(merged.keys()).containsExactly("user_request", "a", "b");
        assertThat(merged.get("b")).contains(2);
        assertThat(merged.get("a")).contains(1);
    }

    @Test
    void mergeStage_neverOverwritesAnotherStagesEntry() {
        AgentState run = AgentState.forRequest("q").with("a", 1);
        AgentState produced = run.with("a", 99).with("b", 2);

        AgentState merged = run.mergeStage(produced, "b");

        assertThat(merged.get("a")).contains(1);
        assertThat(merged.get("b")).contains(2);
    }

    @Test
    void mergeStage_replacesOwnKey() {
        AgentState run = AgentState.forRequest("q").with("b", "draft");
        AgentState produced = run.with("b", "final");

        assertThat(run.mergeStage(produced, "b").get("b")).contains("final");
    }

    @Test
    void mergeStage_sequenceOfStagesAccumulates() {
        AgentState state = AgentState.forRequest("q");
        state = state.mergeStage(state.with("a", 1), "a");
        state = state.mergeStage(state.with("b", 2), "b");

        assertThat(state.keys()).containsExactly("user_request", "a", "b");
        assertThat(state.get("a")).contains(1);
    }

    @Test
    void getMap_returnsEmptyForMissingOrNonMapEntries() {
        AgentState state = AgentState.forRequest("q").with("n", 5);
        assertThat(state.getMap("n")).isEmpty();
        assertThat(state.getMap("missing")).isEmpty();
    }
}
