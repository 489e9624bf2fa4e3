package com.agentrelay.orchestrator.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Identity and metadata of one stage invocation.
 *
 * Immutable: every retry or regeneration gets a new context with
 * {@code retryCount + 1}. Quality-gate guidance for a regeneration travels in
 * {@code metadata["prompt_adjustments"]}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExecutionContext(
        String              runId,
        String              userId,
        String              threadId,
        Map<String, Object> metadata,
        int                 retryCount) {

    public static final String PROMPT_ADJUSTMENTS = "prompt_adjustments";

    public ExecutionContext {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ExecutionContext newRun(String userId, String threadId, Map<String, Object> metadata) {
        String runId = UUID.randomUUID().toString();
        return new ExecutionContext(runId, userId,
                threadId != null ? threadId : "thread-" + runId.substring(0, 8),
                metadata, 0);
    }

    /** Same run, retry counter incremented. */
    public ExecutionContext nextRetry() {
        return new ExecutionContext(runId, userId, threadId, metadata, retryCount + 1);
    }

    /** Same run, retry counter incremented, with the given prompt adjustments attached. */
    public ExecutionContext withPromptAdjustments(Map<String, Object> adjustments) {
        Map<String, Object> next = new LinkedHashMap<>(metadata);
        if (adjustments != null && !adjustments.isEmpty()) {
            next.put(PROMPT_ADJUSTMENTS, Collections.unmodifiableMap(new LinkedHashMap<>(adjustments)));
        }
        return new ExecutionContext(runId, userId, threadId, next, retryCount + 1);
    }

    /** Same context with one more metadata entry (retry counter untouched). */
    public ExecutionContext withMetadata(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(metadata);
        next.put(key, value);
        return new ExecutionContext(runId, userId, threadId, next, retryCount);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> promptAdjustments() {
        Object value = metadata.get(PROMPT_ADJUSTMENTS);
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    /** Free-text instructions from {@code prompt_adjustments.additional_instructions}. */
    public List<String> additionalInstructions() {
        Object value = promptAdjustments().get("additional_instructions");
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
