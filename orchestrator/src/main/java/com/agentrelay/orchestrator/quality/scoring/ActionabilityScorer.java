package com.agentrelay.orchestrator.quality.scoring;

import com.agentrelay.orchestrator.quality.ContentType;
import com.agentrelay.orchestrator.quality.QualityDimension;
import com.agentrelay.orchestrator.quality.QualityPatterns;
import com.agentrelay.orchestrator.quality.TextFeatures;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Can the reader act on this without asking a follow-up question?
 */
@Component
public class ActionabilityScorer implements DimensionScorer {

    private static final Pattern STEP_PREFIX = Pattern.compile(
            "^\\s*(\\d+[.)]|[-*•]|step\\s+\\d+\\s*[:.)-]?)\\s*", Pattern.CASE_INSENSITIVE);

    @Override
    public QualityDimension dimension() {
        return QualityDimension.ACTIONABILITY;
    }

    @Override
    public double score(TextFeatures f, ContentType contentType, Map<String, Object> context) {
        double score = Math.min(0.5, 0.15 * f.actionVerbCount());
        if (f.hasStepStructure())      score += 0.3;
        if (f.hasCodeOrCommand())      score += 0.2;
        if (startsWithImperative(f))   score += 0.1;
        score -= 0.1 * f.hedgeCount();
        return DimensionScorer.clamp(score);
    }

    private static boolean startsWithImperative(TextFeatures f) {
        for (String sentence : f.sentences()) {
            String stripped = STEP_PREFIX.matcher(sentence).replaceFirst("");
            var m = QualityPatterns.ACTION_VERB.matcher(stripped);
            if (m.lookingAt()) return true;
        }
        return false;
    }
}
