package com.agentrelay.orchestrator.llm;

/**
 * A completion call failed. {@code statusCode} is the HTTP status of the API
 * response, or 0 when no response was received.
 */
public class LlmException extends RuntimeException {

    private final int statusCode;

    public LlmException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int statusCode() { return statusCode; }

    /** Rate limiting, overload and transport errors are worth another attempt. */
    public boolean isRetryable() {
        return statusCode == 0 || statusCode == 429 || statusCode == 529 || statusCode >= 500;
    }
}
