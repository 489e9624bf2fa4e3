package com.agentrelay.orchestrator.quality.scoring;

import com.agentrelay.orchestrator.quality.ContentType;
import com.agentrelay.orchestrator.quality.QualityDimension;
import com.agentrelay.orchestrator.quality.TextFeatures;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Starts from 1.0 and subtracts for boilerplate, repetition and vagueness.
 */
@Component
public class NoveltyScorer implements DimensionScorer {

    @Override
    public QualityDimension dimension() {
        return QualityDimension.NOVELTY;
    }

    @Override
    public double score(TextFeatures f, ContentType contentType, Map<String, Object> context) {
        if (f.isBlank()) return 0.0;
        return DimensionScorer.clamp(1.0
                - 0.25 * f.genericPhraseCount()
                - 0.5 * f.redundancyRatio()
                - 0.05 * f.vagueTermCount());
    }
}
