package com.agentrelay.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionContextTest {

    @Test
    void newRun_generatesRunIdAndThreadId() {
        ExecutionContext ctx = ExecutionContext.newRun("u-1", null, null);

        assertThat(ctx.runId()).isNotBlank();
        assertThat(ctx.threadId()).startsWith("thread-");
        assertThat(ctx.retryCount()).isZero();
        assertThat(ctx.metadata()).isEmpty();
    }

    @Test
    void nextRetry_incrementsCounterWithoutMutatingOriginal() {
        ExecutionContext ctx = ExecutionContext.newRun("u-1", "t-1", Map.of("source", "api"));
        ExecutionContext retry = ctx.nextRetry();

        assertThat(ctx.retryCount()).isZero();
        assertThat(retry.retryCount()).isEqualTo(1);
        assertThat(retry.runId()).isEqualTo(ctx.runId());
        assertThat(retry.metadata()).containsEntry("source", "api");
    }

    @Test
    void withPromptAdjustments_exposesInstructions() {
        ExecutionContext ctx = ExecutionContext.newRun("u-1", "t-1", Map.of())
                .withPromptAdjustments(Map.of("additional_instructions", List.of("Use numbers.")));

        assertThat(ctx.retryCount()).isEqualTo(1);
        assertThat(ctx.additionalInstructions()).containsExactly("Use numbers.");
    }
}
