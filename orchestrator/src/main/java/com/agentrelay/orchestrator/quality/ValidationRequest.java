package com.agentrelay.orchestrator.quality;

import java.util.Map;

/** One item of a batch validation. */
public record ValidationRequest(
        String              content,
        ContentType         contentType,
        Map<String, Object> context,
        boolean             strictMode) {

    public ValidationRequest {
        if (contentType == null) contentType = ContentType.GENERAL;
        if (context == null) context = Map.of();
    }

    public ValidationRequest(String content, ContentType contentType) {
        this(content, contentType, Map.of(), false);
    }
}
