package com.agentrelay.orchestrator.quality;

import com.agentrelay.orchestrator.quality.scoring.DimensionScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns content into {@link QualityMetrics}: extracts features once, asks each
 * {@link DimensionScorer} for its sub-score, then combines them with the
 * content type's weights and the negative-indicator penalties.
 *
 * <pre>
 *   overall = Σ weight(d) · score(d)
 *           − min(0.2, 0.05 · genericPhrases)
 *           − 0.1 if circular
 *           − 0.2 · hallucinationRisk
 *           − 0.2 · redundancyRatio
 * </pre>
 *
 * Strict mode can only lower the result: it takes the minimum of the normal
 * score and a harsher variant that also charges for hedging.
 */
@Component
public class QualityMetricsCalculator {

    private static final Logger log = LoggerFactory.getLogger(QualityMetricsCalculator.class);

    static final double WEAK_DIMENSION = 0.5;

    private final TextAnalyzer analyzer;
    private final Map<QualityDimension, DimensionScorer> scorers = new EnumMap<>(QualityDimension.class);

    public QualityMetricsCalculator(TextAnalyzer analyzer, List<DimensionScorer> allScorers) {
        this.analyzer = analyzer;
        for (DimensionScorer scorer : allScorers) {
            DimensionScorer previous = scorers.put(scorer.dimension(), scorer);
            if (previous != null) {
                throw new IllegalStateException("Two scorers for " + scorer.dimension() + ": "
                        + previous.getClass().getSimpleName() + ", " + scorer.getClass().getSimpleName());
            }
        }
        for (QualityDimension d : QualityDimension.values()) {
            if (!scorers.containsKey(d)) {
                throw new IllegalStateException("No scorer registered for dimension " + d);
            }
        }
        log.info("Quality calculator ready with {} dimension scorers", scorers.size());
    }

    /**
     * @throws ValidationComputationException if feature extraction or any scorer fails
     */
    public QualityMetrics calculate(String content, ContentType contentType,
                                    Map<String, Object> context, boolean strict) {
        TextFeatures features;
        try {
            features = analyzer.analyze(content);
        } catch (RuntimeException e) {
            throw new ValidationComputationException("Text analysis failed: " + e.getMessage(), e);
        }
        if (features.isBlank()) {
            return QualityMetrics.failed("Content is empty")
                    .withFindings(List.of(), List.of("Provide a substantive response."));
        }

        ContentProfile profile = ContentProfile.of(contentType);
        Map<String, Object> ctx = context == null ? Map.of() : context;

        Map<QualityDimension, Double> scores = new EnumMap<>(QualityDimension.class);
        for (QualityDimension d : QualityDimension.values()) {
            try {
                scores.put(d, DimensionScorer.clamp(scorers.get(d).score(features, profile.contentType(), ctx)));
            } catch (RuntimeException e) {
                throw new ValidationComputationException(
                        "Scorer for " + d.value() + " failed: " + e.getMessage(), e);
            }
        }

        double overall = overallScore(features, profile, scores);
        if (strict) {
            double harsher = overall * 0.95 - 0.05 * (features.hedgeCount() + features.genericPhraseCount());
            overall = DimensionScorer.clamp(Math.min(overall, harsher));
        }
        overall = round(overall);

        List<String> issues      = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        describe(features, profile, scores, issues, suggestions);

        return new QualityMetrics(
                round(scores.get(QualityDimension.SPECIFICITY)),
                round(scores.get(QualityDimension.ACTIONABILITY)),
                round(scores.get(QualityDimension.QUANTIFICATION)),
                round(scores.get(QualityDimension.RELEVANCE)),
                round(scores.get(QualityDimension.COMPLETENESS)),
                round(scores.get(QualityDimension.NOVELTY)),
                round(scores.get(QualityDimension.CLARITY)),
                features.genericPhraseCount(),
                features.circularReasoning(),
                round(features.hallucinationRisk()),
                round(features.redundancyRatio()),
                features.wordCount(),
                features.sentenceCount(),
                features.numericValueCount(),
                overall,
                QualityLevel.fromScore(overall),
                issues,
                suggestions);
    }

    // ------------------------------------------------------------------
    // Scoring
    // ------------------------------------------------------------------

    private static double overallScore(TextFeatures f, ContentProfile profile,
                                       Map<QualityDimension, Double> scores) {
        double weighted = 0.0;
        for (Map.Entry<QualityDimension, Double> e : scores.entrySet()) {
            weighted += profile.weight(e.getKey()) * e.getValue();
        }
        double penalty = Math.min(0.2, 0.05 * f.genericPhraseCount());
        if (f.circularReasoning()) penalty += 0.1;
        penalty += 0.2 * f.hallucinationRisk();
        penalty += 0.2 * f.redundancyRatio();
        return DimensionScorer.clamp(weighted - penalty);
    }

    private static void describe(TextFeatures f, ContentProfile profile, Map<QualityDimension, Double> scores,
                                 List<String> issues, List<String> suggestions) {
        if (f.genericPhraseCount() > 0) {
            issues.add("Generic phrases: " + String.join(", ", f.genericPhrases().stream()
                    .distinct().map(p -> "'" + p + "'").toList()));
            suggestions.add("Replace generic phrases with concrete statements.");
        }
        if (f.circularReasoning()) {
            issues.add("Circular reasoning detected");
            suggestions.add("Explain the cause with a mechanism or measurement, not a restatement.");
        }
        if (f.hallucinationRisk() >= 0.5) {
            issues.add("High hallucination risk (%.2f)".formatted(f.hallucinationRisk()));
            suggestions.add("Avoid absolute claims and figures that cannot be measured.");
        }
        if (f.redundancyRatio() > 0.3) {
            issues.add("Redundant content (ratio %.2f)".formatted(f.redundancyRatio()));
        }
        for (QualityDimension d : QualityDimension.values()) {
            double score = scores.get(d);
            if (profile.weight(d) > 0 && score < WEAK_DIMENSION) {
                issues.add("Low %s (%.2f)".formatted(d.value(), score));
                suggestions.add(d.instruction());
            }
        }
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
