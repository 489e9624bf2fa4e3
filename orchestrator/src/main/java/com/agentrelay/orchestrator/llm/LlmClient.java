package com.agentrelay.orchestrator.llm;

/**
 * Language-model completion used by the LLM-backed agents.
 */
public interface LlmClient {

    double DEFAULT_TEMPERATURE = 0.7;

    /**
     * @return the assistant's text reply
     * @throws LlmException on transport or API failure
     */
    String complete(String systemPrompt, String userPrompt, double temperature);

    default String complete(String systemPrompt, String userPrompt) {
        return complete(systemPrompt, userPrompt, DEFAULT_TEMPERATURE);
    }
}
