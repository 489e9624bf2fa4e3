package com.agentrelay.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome class of one stage invocation.
 *
 * DEGRADED means the stage produced usable output but it did not clear the
 * quality gate within the regeneration budget.
 */
public enum ExecutionStatus {
    COMPLETED,
    FAILED,
    DEGRADED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
