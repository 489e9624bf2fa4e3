package com.agentrelay.orchestrator.quality;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Outcome of one quality-gate validation.
 *
 * @param retryPromptAdjustments guidance for regenerating the content; empty
 *                               when no retry is suggested
 * @param fallbackResponse       canned replacement for unusable content, or null
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationResult(
        boolean             passed,
        QualityMetrics      metrics,
        boolean             retrySuggested,
        Map<String, Object> retryPromptAdjustments,
        String              fallbackResponse) {

    public ValidationResult {
        retryPromptAdjustments = retryPromptAdjustments == null ? Map.of() : Map.copyOf(retryPromptAdjustments);
    }

    public double overallScore() {
        return metrics.overallScore();
    }
}
