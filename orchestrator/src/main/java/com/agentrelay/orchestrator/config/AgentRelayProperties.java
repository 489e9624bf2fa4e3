package com.agentrelay.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * All {@code agentrelay.*} settings from {@code application.yml}.
 *
 * <pre>
 * agentrelay:
 *   llm:      Anthropic Messages API endpoint, model and HTTP client pool
 *   agents:   per-stage timeout and retry, agent pool limits
 *   breaker:  per-agent circuit breaker
 *   quality:  cache, history and regeneration bounds
 *   workers:  thread pool sizes
 * </pre>
 */
@ConfigurationProperties(prefix = "agentrelay")
public record AgentRelayProperties(
        @DefaultValue Llm     llm,
        @DefaultValue Agents  agents,
        @DefaultValue Breaker breaker,
        @DefaultValue Quality quality,
        @DefaultValue Workers workers) {

    public record Llm(
            @DefaultValue("") String apiKey,
            @DefaultValue("claude-sonnet-4-6") String model,
            @DefaultValue("https://api.anthropic.com/v1/messages") String apiUrl,
            @DefaultValue("4096") int maxTokens,
            @DefaultValue("10s") Duration connectTimeout,
            @DefaultValue("60s") Duration requestTimeout,
            @DefaultValue("1") int poolMinSize,
            @DefaultValue("8") int poolMaxSize) {}

    /**
     * @param maxConcurrent  active agent instances allowed at once
     * @param idleEviction   free instances idle longer than this are destroyed
     * @param timeout        default per-attempt stage timeout
     * @param maxAttempts    default tries per stage, including the first
     */
    public record Agents(
            @DefaultValue("100") int maxConcurrent,
            @DefaultValue("30m") Duration idleEviction,
            @DefaultValue("60s") Duration timeout,
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("1s") Duration retryDelay,
            @DefaultValue("2.0") double backoffFactor,
            @DefaultValue("5m") Duration heartbeatTimeout) {}

    public record Breaker(
            @DefaultValue("3") int failureThreshold,
            @DefaultValue("30s") Duration recoveryTimeout) {}

    /**
     * @param maxRegenerations extra attempts after a failed quality check
     */
    public record Quality(
            @DefaultValue("1000") int cacheSize,
            @DefaultValue("1000") int historySize,
            @DefaultValue("2") int maxRegenerations) {}

    public record Workers(
            @DefaultValue("16") int stageThreads,
            @DefaultValue("4") int runThreads,
            @DefaultValue("4") int validationThreads) {}
}
