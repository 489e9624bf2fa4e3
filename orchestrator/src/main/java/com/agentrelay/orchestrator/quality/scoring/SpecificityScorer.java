package com.agentrelay.orchestrator.quality.scoring;

import com.agentrelay.orchestrator.quality.ContentType;
import com.agentrelay.orchestrator.quality.QualityDimension;
import com.agentrelay.orchestrator.quality.TextFeatures;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Rewards concrete values with units, technical vocabulary and before/after
 * comparisons; penalises filler phrases and vague quantifiers.
 */
@Component
public class SpecificityScorer implements DimensionScorer {

    @Override
    public QualityDimension dimension() {
        return QualityDimension.SPECIFICITY;
    }

    @Override
    public double score(TextFeatures f, ContentType contentType, Map<String, Object> context) {
        double score = 0.0;
        if (f.unitValueCount() > 0)  score += 0.3;
        if (f.unitValueCount() >= 3) score += 0.1;
        score += Math.min(0.3, 0.1 * f.technicalTermCount());
        if (f.hasComparison())       score += 0.2;
        if (f.hasCodeOrCommand())    score += 0.1;
        if (f.percentageCount() > 0) score += 0.1;

        score -= 0.15 * f.genericPhraseCount();
        score -= 0.05 * f.vagueTermCount();
        return DimensionScorer.clamp(score);
    }
}
