package com.agentrelay.orchestrator.store;

public class MetricsStoreException extends RuntimeException {
    public MetricsStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
