package com.agentrelay.orchestrator.quality.scoring;

import com.agentrelay.orchestrator.quality.ContentType;
import com.agentrelay.orchestrator.quality.QualityDimension;
import com.agentrelay.orchestrator.quality.TextFeatures;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class QuantificationScorer implements DimensionScorer {

    @Override
    public QualityDimension dimension() {
        return QualityDimension.QUANTIFICATION;
    }

    /** Values with units count more than bare numbers; a before/after pair adds a bonus. */
    @Override
    public double score(TextFeatures f, ContentType contentType, Map<String, Object> context) {
        int bare = Math.max(0, f.numericValueCount() - f.unitValueCount());
        double score = 0.25 * f.unitValueCount() + 0.1 * bare;
        if (f.hasComparison()) score += 0.25;
        return DimensionScorer.clamp(score);
    }
}
