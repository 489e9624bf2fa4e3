package com.agentrelay.orchestrator.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OrchestrationMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final OrchestrationMetrics metrics = new OrchestrationMetrics(registry);

    @Test
    void snapshot_noExecutions_successRateIsZero() {
        OrchestrationSnapshot snapshot = metrics.snapshot();
        assertThat(snapshot.successRate()).isEqualTo(0.0);
        assertThat(snapshot.averageExecutionTime()).isEqualTo(0.0);
    }

    @Test
    void snapshot_computesRateAndAverage() {
        metrics.recordSuccess(100);
        metrics.recordSuccess(200);
        metrics.recordSuccess(300);
        metrics.recordFailure(400);

        OrchestrationSnapshot snapshot = metrics.snapshot();
        assertThat(snapshot.totalExecutions()).isEqualTo(4);
        assertThat(snapshot.failedExecutions()).isEqualTo(1);
        assertThat(snapshot.successRate()).isCloseTo(75.0, within(1e-9));
        assertThat(snapshot.averageExecutionTime()).isCloseTo(250.0, within(1e-9));
    }

    @Test
    void executions_areMirroredToMicrometer() {
        metrics.recordSuccess(10);
        metrics.recordFailure(10);
        metrics.updateAgentCounts(3, 1);

        assertThat(registry.get("agentrelay.stage.executions").tag("outcome", "success").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("agentrelay.stage.executions").tag("outcome", "failure").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("agentrelay.agents.active").gauge().value()).isEqualTo(3.0);
        assertThat(registry.get("agentrelay.agents.peak").gauge().value()).isEqualTo(3.0);
    }
}
