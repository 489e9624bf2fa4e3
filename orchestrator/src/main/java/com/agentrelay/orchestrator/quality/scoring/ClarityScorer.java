package com.agentrelay.orchestrator.quality.scoring;

import com.agentrelay.orchestrator.quality.ContentType;
import com.agentrelay.orchestrator.quality.QualityDimension;
import com.agentrelay.orchestrator.quality.TextFeatures;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Short sentences read better. Fragments under five words are penalised.
 */
@Component
public class ClarityScorer implements DimensionScorer {

    private static final double COMFORTABLE_SENTENCE_WORDS = 25.0;

    @Override
    public QualityDimension dimension() {
        return QualityDimension.CLARITY;
    }

    @Override
    public double score(TextFeatures f, ContentType contentType, Map<String, Object> context) {
        if (f.isBlank()) return 0.0;
        double avg = f.averageSentenceLength();
        double score = avg <= COMFORTABLE_SENTENCE_WORDS
                ? 1.0
                : Math.max(0.2, 1.0 - (avg - COMFORTABLE_SENTENCE_WORDS) / 40.0);
        if (f.wordCount() < 5) score *= 0.6;
        return DimensionScorer.clamp(score);
    }
}
