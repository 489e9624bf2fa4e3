package com.agentrelay.orchestrator.llm;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class LlmExceptionTest {

    @Test
    void isRetryable_rateLimitOverloadAndServerErrors() {
        assertThat(new LlmException(429, "rate limited").isRetryable()).isTrue();
        assertThat(new LlmException(529, "overloaded").isRetryable()).isTrue();
        assertThat(new LlmException(500, "internal").isRetryable()).isTrue();
        assertThat(new LlmException(503, "unavailable").isRetryable()).isTrue();
    }

    @Test
    void isRetryable_clientErrorsAreFinal() {
        assertThat(new LlmException(400, "bad request").isRetryable()).isFalse();
        assertThat(new LlmException(401, "unauthorized").isRetryable()).isFalse();
    }

    @Test
    void isRetryable_transportFailureHasNoStatusAndIsRetryable() {
        LlmException e = new LlmException("connection reset", new IOException("reset"));
        assertThat(e.statusCode()).isZero();
        assertThat(e.isRetryable()).isTrue();
    }
}
