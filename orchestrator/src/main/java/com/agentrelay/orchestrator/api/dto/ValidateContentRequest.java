package com.agentrelay.orchestrator.api.dto;

import com.agentrelay.orchestrator.quality.ContentType;
import com.agentrelay.orchestrator.quality.ValidationRequest;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Request body for POST /quality/validate (and one element of the batch variant).
 * contentType defaults to "general".
 */
public record ValidateContentRequest(
        @NotNull String     content,
        String              contentType,
        Map<String, Object> context,
        boolean             strictMode
) {
    /** @throws IllegalArgumentException for an unknown content type */
    public ValidationRequest toValidationRequest() {
        return new ValidationRequest(content, ContentType.fromValue(contentType), context, strictMode);
    }
}
