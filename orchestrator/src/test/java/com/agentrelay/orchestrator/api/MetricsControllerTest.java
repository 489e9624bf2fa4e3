package com.agentrelay.orchestrator.api;

import com.agentrelay.orchestrator.agent.AgentManifest;
import com.agentrelay.orchestrator.agent.AgentRegistry;
import com.agentrelay.orchestrator.quality.ContentType;
import com.agentrelay.orchestrator.resilience.CircuitBreakerRegistry;
import com.agentrelay.orchestrator.resilience.CircuitState;
import com.agentrelay.orchestrator.service.AgentPool;
import com.agentrelay.orchestrator.service.OrchestrationMetrics;
import com.agentrelay.orchestrator.service.OrchestrationSnapshot;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MetricsController.class)
class MetricsControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean OrchestrationMetrics   metrics;
    @MockitoBean AgentPool              agentPool;
    @MockitoBean CircuitBreakerRegistry breakers;
    @MockitoBean AgentRegistry          registry;

    @Test
    void metrics_reportsSnapshotPoolAndBreakers() throws Exception {
        when(metrics.snapshot()).thenReturn(new OrchestrationSnapshot(5, 1, 3, 1, 4, 20, 5, 250.0, 75.0));
        when(agentPool.activeCount()).thenReturn(3);
        when(agentPool.pooledCount()).thenReturn(1);
        when(agentPool.maxConcurrent()).thenReturn(50);
        when(breakers.states()).thenReturn(Map.of("triage", CircuitState.OPEN));

        mockMvc.perform(get("/orchestration/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orchestration.success_rate").value(75.0))
                .andExpect(jsonPath("$.orchestration.concurrent_peak").value(4))
                .andExpect(jsonPath("$.agent_pool.max_concurrent").value(50))
                .andExpect(jsonPath("$.circuit_breakers.triage").exists())
                .andExpect(jsonPath("$.llm_pool").doesNotExist());
    }

    @Test
    void agents_listsManifests() throws Exception {
        when(registry.describeCapabilities()).thenReturn(List.of(
                new AgentManifest("triage", "1.0.0", "Classifies", "triage_result", ContentType.TRIAGE, false)));

        mockMvc.perform(get("/orchestration/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("triage"))
                .andExpect(jsonPath("$[0].stateKey").value("triage_result"));
    }
}
