package com.agentrelay.orchestrator.quality;

/**
 * A scorer or analyzer failed while computing metrics. Never leaves
 * {@link QualityGateService}: it is converted into a failed validation.
 */
public class ValidationComputationException extends RuntimeException {
    public ValidationComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
