package com.agentrelay.orchestrator.quality;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the regeneration hints and fallback text attached to a failed
 * {@link ValidationResult}.
 *
 * Adjustment keys:
 * <pre>
 *   focus_dimensions         weak dimensions, by name
 *   additional_instructions  one instruction per weak dimension, plus indicator fixes
 *   avoid_phrases            generic phrases found in the content
 *   temperature              sampling temperature for the regeneration
 *   min_quality_score        overall score the regeneration has to reach
 * </pre>
 */
final class RetryGuidance {

    static final double RETRY_TEMPERATURE = 0.3;

    private static final Map<ContentType, String> FALLBACKS = Map.of(
            ContentType.OPTIMIZATION,
            "I could not produce a specific optimization recommendation. Please share current metrics "
                    + "(latency, throughput, cost or memory usage) and the target you want to reach.",
            ContentType.DATA_ANALYSIS,
            "The available data was not sufficient for a reliable analysis. Please provide the dataset "
                    + "or the time range and metrics to analyze.",
            ContentType.ACTION_PLAN,
            "I could not derive a concrete action plan. Please describe the system and the change you "
                    + "want to make.",
            ContentType.REPORT,
            "A complete report could not be generated from the results collected so far.",
            ContentType.TRIAGE,
            "I could not classify this request. Please describe the problem in more detail.",
            ContentType.ERROR_MESSAGE,
            "The request failed. Please try again; if the problem persists, contact support.",
            ContentType.GENERAL,
            "I could not produce a useful answer to this request. Please add more detail and try again.");

    private RetryGuidance() {}

    static Map<String, Object> adjustments(QualityMetrics metrics, ContentProfile profile,
                                           String content, boolean strict) {
        List<String> focus = new ArrayList<>();
        List<String> instructions = new ArrayList<>();
        for (QualityDimension d : QualityDimension.values()) {
            if (profile.weight(d) > 0 && metrics.score(d) < QualityMetricsCalculator.WEAK_DIMENSION) {
                focus.add(d.value());
                instructions.add(d.instruction());
            }
        }
        if (metrics.circularReasoning()) {
            instructions.add("Explain causes with mechanisms or measurements, not restatements.");
        }
        if (metrics.hallucinationRisk() >= 0.5) {
            instructions.add("Do not claim guarantees or improvements above 100%.");
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("focus_dimensions", List.copyOf(focus));
        out.put("additional_instructions", List.copyOf(instructions));
        out.put("avoid_phrases", genericPhrasesIn(content));
        out.put("temperature", RETRY_TEMPERATURE);
        out.put("min_quality_score", profile.minOverall(strict));
        return out;
    }

    private static List<String> genericPhrasesIn(String content) {
        String lower = content == null ? "" : content.toLowerCase(Locale.ROOT);
        return QualityPatterns.GENERIC_PHRASES.stream().filter(lower::contains).toList();
    }

    /** Canned replacement, only for content too poor to show at all. */
    static String fallback(QualityMetrics metrics, ContentType type) {
        if (metrics.qualityLevel() != QualityLevel.UNACCEPTABLE) return null;
        return FALLBACKS.get(type);
    }
}
