package com.agentrelay.orchestrator.config;

import com.agentrelay.orchestrator.agent.AgentRegistry;
import com.agentrelay.orchestrator.event.StatusEventSink;
import com.agentrelay.orchestrator.quality.QualityGateService;
import com.agentrelay.orchestrator.quality.QualityMetricsCalculator;
import com.agentrelay.orchestrator.resilience.CircuitBreakerRegistry;
import com.agentrelay.orchestrator.resilience.TimeoutExecutor;
import com.agentrelay.orchestrator.service.AgentPool;
import com.agentrelay.orchestrator.service.ExecutionTracker;
import com.agentrelay.orchestrator.service.OrchestrationMetrics;
import com.agentrelay.orchestrator.service.RunScheduler;
import com.agentrelay.orchestrator.service.Supervisor;
import com.agentrelay.orchestrator.service.SupervisorSettings;
import com.agentrelay.orchestrator.store.MetricsStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the orchestration core. Components with no Spring dependencies of
 * their own (supervisor, pool, tracker, quality gate) are plain classes built
 * here so tests can construct them directly.
 */
@Configuration
@EnableConfigurationProperties(AgentRelayProperties.class)
public class OrchestratorConfig {

    // ------------------------------------------------------------------
    // Thread pools
    // ------------------------------------------------------------------

    /** Fan-out branches of a parallel step. */
    @Bean(destroyMethod = "shutdown")
    ExecutorService stageExecutor(AgentRelayProperties properties) {
        return Executors.newFixedThreadPool(properties.workers().stageThreads(), named("stage"));
    }

    /** Runs agent attempts under a deadline; threads of timed-out attempts are abandoned, hence unbounded. */
    @Bean(destroyMethod = "shutdown")
    ExecutorService timeoutExecutor() {
        return Executors.newCachedThreadPool(named("attempt"));
    }

    @Bean(destroyMethod = "shutdown")
    ExecutorService runExecutor(AgentRelayProperties properties) {
        return Executors.newFixedThreadPool(properties.workers().runThreads(), named("run"));
    }

    @Bean(destroyMethod = "shutdown")
    ExecutorService validationExecutor(AgentRelayProperties properties) {
        return Executors.newFixedThreadPool(properties.workers().validationThreads(), named("validation"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "agentrelay-" + prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // ------------------------------------------------------------------
    // Resilience
    // ------------------------------------------------------------------

    @Bean
    CircuitBreakerRegistry circuitBreakerRegistry(AgentRelayProperties properties) {
        return new CircuitBreakerRegistry(
                properties.breaker().failureThreshold(),
                properties.breaker().recoveryTimeout());
    }

    @Bean
    TimeoutExecutor timeoutRunner(@Qualifier("timeoutExecutor") ExecutorService workers) {
        return new TimeoutExecutor(workers);
    }

    // ------------------------------------------------------------------
    // Quality gate
    // ------------------------------------------------------------------

    @Bean
    QualityGateService qualityGateService(QualityMetricsCalculator calculator,
                                          ObjectProvider<MetricsStore> store,
                                          MeterRegistry meterRegistry,
                                          @Qualifier("validationExecutor") ExecutorService validationExecutor,
                                          AgentRelayProperties properties) {
        return new QualityGateService(calculator, store.getIfAvailable(), meterRegistry, validationExecutor,
                properties.quality().cacheSize(), properties.quality().historySize());
    }

    // ------------------------------------------------------------------
    // Orchestration
    // ------------------------------------------------------------------

    @Bean
    OrchestrationMetrics orchestrationMetrics(MeterRegistry meterRegistry) {
        return new OrchestrationMetrics(meterRegistry);
    }

    @Bean
    AgentPool agentPool(AgentRelayProperties properties, OrchestrationMetrics metrics) {
        return new AgentPool(properties.agents().maxConcurrent(), metrics);
    }

    @Bean
    ExecutionTracker executionTracker() {
        return new ExecutionTracker();
    }

    @Bean
    Supervisor supervisor(AgentRegistry registry,
                          QualityGateService qualityGate,
                          CircuitBreakerRegistry breakers,
                          TimeoutExecutor timeouts,
                          @Qualifier("stageExecutor") ExecutorService stageExecutor,
                          AgentPool agentPool,
                          OrchestrationMetrics metrics,
                          ExecutionTracker tracker,
                          StatusEventSink events,
                          MeterRegistry meterRegistry,
                          AgentRelayProperties properties) {
        AgentRelayProperties.Agents agents = properties.agents();
        SupervisorSettings settings = new SupervisorSettings(
                agents.timeout(),
                agents.maxAttempts(),
                agents.retryDelay(),
                agents.backoffFactor(),
                properties.quality().maxRegenerations());
        return new Supervisor(registry, qualityGate, breakers, timeouts, stageExecutor,
                agentPool, metrics, tracker, events, meterRegistry, settings);
    }

    @Bean
    RunScheduler runScheduler(Supervisor supervisor, AgentPool agentPool, ExecutionTracker tracker,
                              @Qualifier("runExecutor") ExecutorService runExecutor) {
        return new RunScheduler(supervisor, agentPool, tracker, runExecutor);
    }
}
