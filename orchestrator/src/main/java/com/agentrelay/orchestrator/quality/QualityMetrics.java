package com.agentrelay.orchestrator.quality;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores for one piece of content.
 *
 * Positive sub-scores are in [0, 1]. The negative indicators lower
 * {@code overallScore}; the meta counts are informational.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QualityMetrics(
        double       specificityScore,
        double       actionabilityScore,
        double       quantificationScore,
        double       relevanceScore,
        double       completenessScore,
        double       noveltyScore,
        double       clarityScore,

        int          genericPhraseCount,
        boolean      circularReasoning,
        double       hallucinationRisk,
        double       redundancyRatio,

        int          wordCount,
        int          sentenceCount,
        int          numericValueCount,

        double       overallScore,
        QualityLevel qualityLevel,
        List<String> issues,
        List<String> suggestions) {

    public QualityMetrics {
        issues      = issues == null ? List.of() : List.copyOf(issues);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    /** Metrics for content that could not be scored at all. */
    public static QualityMetrics failed(String issue) {
        return new QualityMetrics(0, 0, 0, 0, 0, 0, 0,
                0, false, 0, 0,
                0, 0, 0,
                0.0, QualityLevel.UNACCEPTABLE, List.of(issue), List.of());
    }

    public double score(QualityDimension dimension) {
        return switch (dimension) {
            case SPECIFICITY    -> specificityScore;
            case ACTIONABILITY  -> actionabilityScore;
            case QUANTIFICATION -> quantificationScore;
            case RELEVANCE      -> relevanceScore;
            case COMPLETENESS   -> completenessScore;
            case NOVELTY        -> noveltyScore;
            case CLARITY        -> clarityScore;
        };
    }

    /** Flat view used for persistence. */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("specificity_score", specificityScore);
        out.put("actionability_score", actionabilityScore);
        out.put("quantification_score", quantificationScore);
        out.put("relevance_score", relevanceScore);
        out.put("completeness_score", completenessScore);
        out.put("novelty_score", noveltyScore);
        out.put("clarity_score", clarityScore);
        out.put("generic_phrase_count", genericPhraseCount);
        out.put("circular_reasoning", circularReasoning);
        out.put("hallucination_risk", hallucinationRisk);
        out.put("redundancy_ratio", redundancyRatio);
        out.put("word_count", wordCount);
        out.put("sentence_count", sentenceCount);
        out.put("numeric_value_count", numericValueCount);
        out.put("overall_score", overallScore);
        out.put("quality_level", qualityLevel.value());
        out.put("issues", issues);
        return out;
    }

    /** Copy with extra issues and suggestions appended. */
    public QualityMetrics withFindings(List<String> moreIssues, List<String> moreSuggestions) {
        List<String> i = new ArrayList<>(issues);
        i.addAll(moreIssues);
        List<String> s = new ArrayList<>(suggestions);
        s.addAll(moreSuggestions);
        return new QualityMetrics(specificityScore, actionabilityScore, quantificationScore,
                relevanceScore, completenessScore, noveltyScore, clarityScore,
                genericPhraseCount, circularReasoning, hallucinationRisk, redundancyRatio,
                wordCount, sentenceCount, numericValueCount,
                overallScore, qualityLevel, i, s);
    }
}
