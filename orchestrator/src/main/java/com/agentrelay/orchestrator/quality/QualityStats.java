package com.agentrelay.orchestrator.quality;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * Summary over the most recent validations of one content type (or of all
 * types when {@code contentType} is null).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QualityStats(
        ContentType               contentType,
        int                       count,
        double                    minScore,
        double                    maxScore,
        double                    averageScore,
        Map<QualityLevel, Integer> qualityDistribution) {

    public static QualityStats empty(ContentType contentType) {
        return new QualityStats(contentType, 0, 0.0, 0.0, 0.0, Map.of());
    }
}
