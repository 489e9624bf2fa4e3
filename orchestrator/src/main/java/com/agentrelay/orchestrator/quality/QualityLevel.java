package com.agentrelay.orchestrator.quality;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Discretised overall score.
 */
public enum QualityLevel {
    EXCELLENT(0.9),
    GOOD(0.7),
    ACCEPTABLE(0.5),
    POOR(0.3),
    UNACCEPTABLE(0.0);

    private final double floor;

    QualityLevel(double floor) {
        this.floor = floor;
    }

    public double floor() { return floor; }

    public static QualityLevel fromScore(double score) {
        for (QualityLevel level : values()) {
            if (score >= level.floor) return level;
        }
        return UNACCEPTABLE;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
