package com.agentrelay.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a run.
 *
 * Transitions:
 *   PENDING → RUNNING → COMPLETED | DEGRADED | FAILED
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,   // every executed stage completed
    DEGRADED,    // some stage failed or fell below the quality bar, but output exists
    FAILED;      // no stage produced output

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == DEGRADED || this == FAILED;
    }
}
