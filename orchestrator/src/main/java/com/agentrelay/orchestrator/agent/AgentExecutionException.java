package com.agentrelay.orchestrator.agent;

/**
 * An agent failed in a way the supervisor can retry or report.
 *
 * Unchecked so callers only catch it when they have a specific recovery
 * strategy; the supervisor's retry layer sees it like any other failure.
 */
public class AgentExecutionException extends RuntimeException {

    public enum Kind { EXECUTION_ERROR, PARSE_ERROR, INVALID_INPUT }

    private final Kind kind;

    public AgentExecutionException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public AgentExecutionException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
