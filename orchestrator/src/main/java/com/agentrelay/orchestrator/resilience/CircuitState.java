package com.agentrelay.orchestrator.resilience;

/**
 * Transitions:
 *   CLOSED    → OPEN      (failure count reaches the threshold)
 *   OPEN      → HALF_OPEN (recovery timeout elapsed, one trial call admitted)
 *   HALF_OPEN → CLOSED    (trial call succeeded)
 *   HALF_OPEN → OPEN      (trial call failed, timeout window restarts)
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
