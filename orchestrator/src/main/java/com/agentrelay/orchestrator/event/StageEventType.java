package com.agentrelay.orchestrator.event;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StageEventType {
    RUN_STARTED,
    AGENT_STARTED,
    AGENT_COMPLETED,
    AGENT_DEGRADED,
    AGENT_FAILED,
    RUN_COMPLETED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
