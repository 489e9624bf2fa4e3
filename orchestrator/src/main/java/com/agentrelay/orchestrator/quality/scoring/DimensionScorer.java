package com.agentrelay.orchestrator.quality.scoring;

import com.agentrelay.orchestrator.quality.ContentType;
import com.agentrelay.orchestrator.quality.QualityDimension;
import com.agentrelay.orchestrator.quality.TextFeatures;

import java.util.Map;

/**
 * Scores one {@link QualityDimension} of a piece of content.
 *
 * <p>Every implementation declared as a Spring {@code @Component} is collected
 * by {@link com.agentrelay.orchestrator.quality.QualityMetricsCalculator};
 * exactly one scorer per dimension must be present. Replacing a heuristic
 * only requires a different bean for that dimension.
 *
 * <p>Implementations must be stateless and return a value in [0, 1].
 */
public interface DimensionScorer {

    QualityDimension dimension();

    /**
     * @param context caller-supplied hints, e.g. {@code user_request}; never null
     */
    double score(TextFeatures features, ContentType contentType, Map<String, Object> context);

    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
