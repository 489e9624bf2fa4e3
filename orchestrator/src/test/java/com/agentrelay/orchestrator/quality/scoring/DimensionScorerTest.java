package com.agentrelay.orchestrator.quality.scoring;

import com.agentrelay.orchestrator.quality.ContentType;
import com.agentrelay.orchestrator.quality.QualityDimension;
import com.agentrelay.orchestrator.quality.QualityMetricsCalculator;
import com.agentrelay.orchestrator.quality.QualityTestSupport;
import com.agentrelay.orchestrator.quality.TextAnalyzer;
import com.agentrelay.orchestrator.quality.TextFeatures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.agentrelay.orchestrator.quality.QualityTestSupport.GENERIC;
import static com.agentrelay.orchestrator.quality.QualityTestSupport.GPU;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DimensionScorerTest {

    private final TextAnalyzer analyzer = new TextAnalyzer();

    private double score(DimensionScorer scorer, String content) {
        TextFeatures f = analyzer.analyze(content);
        return scorer.score(f, ContentType.OPTIMIZATION, Map.of());
    }

    @Test
    void specificity_genericTextScoresZero_quantifiedTextScoresHigh() {
        SpecificityScorer scorer = new SpecificityScorer();

        assertThat(score(scorer, GENERIC)).isZero();
        assertThat(score(scorer, GPU)).isGreaterThanOrEqualTo(0.5);
    }

    @Test
    void quantification_unitsAndComparisonSaturate() {
        assertThat(score(new QuantificationScorer(), GPU)).isEqualTo(1.0);
        assertThat(score(new QuantificationScorer(), GENERIC)).isZero();
    }

    @Test
    void novelty_blankIsZero_boilerplateIsPenalised() {
        NoveltyScorer scorer = new NoveltyScorer();

        assertThat(score(scorer, "")).isZero();
        assertThat(score(scorer, GENERIC)).isLessThan(score(scorer, GPU));
    }

    @Test
    void everyDefaultScorer_staysInUnitRange() {
        for (DimensionScorer scorer : QualityTestSupport.defaultScorers()) {
            for (String content : List.of("", GENERIC, GPU, "x".repeat(5000))) {
                assertThat(score(scorer, content))
                        .as("%s on %d chars", scorer.dimension(), content.length())
                        .isBetween(0.0, 1.0);
            }
        }
    }

    @Test
    void clamp_handlesNanAndBounds() {
        assertThat(DimensionScorer.clamp(Double.NaN)).isZero();
        assertThat(DimensionScorer.clamp(-0.2)).isZero();
        assertThat(DimensionScorer.clamp(1.7)).isEqualTo(1.0);
    }

    @Test
    void calculator_requiresExactlyOneScorerPerDimension() {
        List<DimensionScorer> missing = QualityTestSupport.defaultScorers();
        missing.removeIf(s -> s.dimension() == QualityDimension.CLARITY);
        assertThatThrownBy(() -> new QualityMetricsCalculator(analyzer, missing))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("CLARITY");

        List<DimensionScorer> duplicate = QualityTestSupport.defaultScorers();
        duplicate.add(new ClarityScorer());
        assertThatThrownBy(() -> new QualityMetricsCalculator(analyzer, duplicate))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Two scorers");
    }
}
