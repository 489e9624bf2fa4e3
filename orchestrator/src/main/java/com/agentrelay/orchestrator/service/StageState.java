package com.agentrelay.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StageState {
    RUNNING,
    /** Running, but no heartbeat within the janitor's heartbeat timeout. */
    STALLED,
    COMPLETED,
    DEGRADED,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
