package com.agentrelay.orchestrator.api;

import com.agentrelay.orchestrator.agent.AgentManifest;
import com.agentrelay.orchestrator.agent.AgentRegistry;
import com.agentrelay.orchestrator.llm.ClaudeClient;
import com.agentrelay.orchestrator.resilience.CircuitBreakerRegistry;
import com.agentrelay.orchestrator.service.AgentPool;
import com.agentrelay.orchestrator.service.OrchestrationMetrics;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GET /orchestration/metrics  - counters, agent pool, circuit breakers and LLM connection pool
 * GET /orchestration/agents   - registered agents and what they produce
 */
@RestController
@RequestMapping("/orchestration")
public class MetricsController {

    private final OrchestrationMetrics         metrics;
    private final AgentPool                    agentPool;
    private final CircuitBreakerRegistry       breakers;
    private final AgentRegistry                registry;
    private final ObjectProvider<ClaudeClient> claude;

    public MetricsController(OrchestrationMetrics metrics,
                             AgentPool agentPool,
                             CircuitBreakerRegistry breakers,
                             AgentRegistry registry,
                             ObjectProvider<ClaudeClient> claude) {
        this.metrics   = metrics;
        this.agentPool = agentPool;
        this.breakers  = breakers;
        this.registry  = registry;
        this.claude    = claude;
    }

    @GetMapping("/metrics")
    public Map<String, Object> metrics() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("orchestration", metrics.snapshot());
        body.put("agent_pool", Map.of(
                "active", agentPool.activeCount(),
                "pooled", agentPool.pooledCount(),
                "max_concurrent", agentPool.maxConcurrent()));
        body.put("circuit_breakers", breakers.states());
        ClaudeClient client = claude.getIfAvailable();
        if (client != null) {
            body.put("llm_pool", client.poolStats());
        }
        return body;
    }

    @GetMapping("/agents")
    public List<AgentManifest> agents() {
        return registry.describeCapabilities();
    }
}
