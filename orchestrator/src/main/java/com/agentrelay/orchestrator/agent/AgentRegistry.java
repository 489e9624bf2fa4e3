package com.agentrelay.orchestrator.agent;

import com.agentrelay.orchestrator.model.AgentState;
import com.agentrelay.orchestrator.model.ExecutionContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process agent registry.
 *
 * <p>All {@link Agent} beans are collected at startup via constructor
 * injection and keyed by {@link AgentManifest#name()}. Responsibilities:
 * <ol>
 *   <li>Lookup by key ({@link #get}).</li>
 *   <li>Metrics-instrumented execution ({@link #execute}): every call is timed
 *       and counted, with no per-agent boilerplate.</li>
 *   <li>A capability listing ({@link #describeCapabilities}) generated from the
 *       live manifests.</li>
 * </ol>
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public AgentRegistry(List<Agent> allAgents, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (Agent agent : allAgents) {
            AgentManifest m = agent.manifest();
            Agent previous = agents.put(m.name(), agent);
            if (previous != null) {
                throw new IllegalStateException("Duplicate agent key '" + m.name() + "'");
            }
            log.info("Registered agent '{}' v{} -> {} [{}{}]",
                    m.name(), m.version(), m.stateKey(), m.contentType().value(),
                    m.qualityGated() ? ", gated" : "");
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Agent get(String agentKey) {
        Agent agent = agentKey == null ? null : agents.get(agentKey);
        if (agent == null) {
            throw new AgentNotFoundException(agentKey);
        }
        return agent;
    }

    public boolean contains(String agentKey) {
        return agentKey != null && agents.containsKey(agentKey);
    }

    /** All registered keys, sorted. */
    public List<String> agentKeys() {
        return agents.keySet().stream().sorted().toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Execute one agent.
     *
     * <pre>
     *   agentrelay.agent.calls{agent, status="success|failed|error|parse_error|..."}
     *   agentrelay.agent.duration{agent}
     * </pre>
     *
     * @throws AgentNotFoundException  if the key is unknown
     * @throws AgentExecutionException on any failure inside the agent
     */
    public AgentOutcome execute(String agentKey, ExecutionContext context, AgentState state) {
        Agent agent = get(agentKey);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            AgentOutcome outcome = agent.execute(context, state);
            if (outcome == null) {
                throw new AgentExecutionException(AgentExecutionException.Kind.EXECUTION_ERROR,
                        "Agent '" + agentKey + "' returned no outcome");
            }
            if (!outcome.result().success()) status = "failed";
            return outcome;
        } catch (AgentExecutionException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            throw new AgentExecutionException(AgentExecutionException.Kind.EXECUTION_ERROR,
                    "Unexpected error in agent '" + agentKey + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("agentrelay.agent.duration", "agent", agentKey));
            meterRegistry.counter("agentrelay.agent.calls", "agent", agentKey, "status", status).increment();
        }
    }

    // ------------------------------------------------------------------
    // Capability listing
    // ------------------------------------------------------------------

    /** One entry per agent, sorted by key. */
    public List<AgentManifest> describeCapabilities() {
        return agents.values().stream()
                .map(Agent::manifest)
                .sorted(Comparator.comparing(AgentManifest::name))
                .toList();
    }
}
