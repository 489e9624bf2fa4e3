package com.agentrelay.orchestrator.quality;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of text being validated. Each type carries its own dimension weights
 * and pass thresholds (see {@link ContentProfile}).
 */
public enum ContentType {
    OPTIMIZATION,
    DATA_ANALYSIS,
    ACTION_PLAN,
    REPORT,
    TRIAGE,
    ERROR_MESSAGE,
    GENERAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ContentType fromValue(String value) {
        if (value == null || value.isBlank()) return GENERAL;
        return ContentType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
