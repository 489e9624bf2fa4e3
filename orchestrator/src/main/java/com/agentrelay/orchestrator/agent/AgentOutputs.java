package com.agentrelay.orchestrator.agent;

import java.util.Collection;
import java.util.Map;

/**
 * Flattens agent payloads (nested maps, lists, scalars) into plain text,
 * one value per line. Keys and boolean flags are dropped.
 */
public final class AgentOutputs {

    private AgentOutputs() {}

    public static String toText(Object payload) {
        StringBuilder sb = new StringBuilder();
        append(sb, payload);
        return sb.toString().strip();
    }

    private static void append(StringBuilder sb, Object value) {
        if (value == null) return;
        if (value instanceof Map<?, ?> map) {
            map.values().forEach(v -> append(sb, v));
        } else if (value instanceof Collection<?> items) {
            items.forEach(v -> append(sb, v));
        } else if (!(value instanceof Boolean)) {
            String text = value.toString().strip();
            if (!text.isEmpty()) sb.append(text).append('\n');
        }
    }
}
