package com.agentrelay.orchestrator.resilience;

import org.slf4j.MDC;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Carries the caller's MDC (runId, userId, stage, attempt) onto worker threads,
 * so log lines written inside a timed or fanned-out stage keep their context.
 */
public final class MdcPropagation {

    private MdcPropagation() {}

    /** Captures the current MDC now; installs it around {@code work} on whatever thread runs it. */
    public static <T> Supplier<T> wrap(Supplier<T> work) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) MDC.setContextMap(captured); else MDC.clear();
            try {
                return work.get();
            } finally {
                if (previous != null) MDC.setContextMap(previous); else MDC.clear();
            }
        };
    }
}
