package com.agentrelay.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Accumulated stage outputs of one run, keyed by stage key
 * (e.g. {@code triage_result}, {@code data_result}).
 *
 * <p>Copy-on-write: every mutator returns a new instance and never touches
 * the receiver, so fan-out siblings reading the same snapshot cannot observe
 * each other's writes. Insertion order is preserved.
 *
 * <p>{@link #mergeStage} is the only way the supervisor folds a stage's output
 * back into the run state: keys the stage added are appended, the stage's own
 * key is replaced, and entries written by other stages are kept as they were.
 */
public final class AgentState {

    public static final String USER_REQUEST = "user_request";

    private static final AgentState EMPTY = new AgentState(Map.of());

    private final Map<String, Object> entries;

    private AgentState(Map<String, Object> entries) {
        this.entries = entries;
    }

    public static AgentState empty() {
        return EMPTY;
    }

    @JsonCreator
    public static AgentState of(Map<String, Object> entries) {
        if (entries == null || entries.isEmpty()) return EMPTY;
        return new AgentState(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    public static AgentState forRequest(String userRequest) {
        return EMPTY.with(USER_REQUEST, userRequest);
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public Optional<Object> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = entries.get(key);
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    public boolean contains(String key) { return entries.containsKey(key); }
    public Set<String> keys()           { return entries.keySet(); }
    public int size()                   { return entries.size(); }

    public String userRequest() {
        Object value = entries.get(USER_REQUEST);
        return value != null ? value.toString() : "";
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return entries;
    }

    // ------------------------------------------------------------------
    // Copy-on-write updates
    // ------------------------------------------------------------------

    public AgentState with(String key, Object value) {
        Objects.requireNonNull(key, "key");
        Map<String, Object> next = new LinkedHashMap<>(entries);
        next.put(key, value);
        return new AgentState(Collections.unmodifiableMap(next));
    }

    /**
     * Entries of {@code produced} that are absent from, or differ from, this state.
     */
    public Map<String, Object> diff(AgentState produced) {
        Map<String, Object> out = new LinkedHashMap<>();
        produced.entries.forEach((k, v) -> {
            if (!entries.containsKey(k) || !Objects.equals(entries.get(k), v)) {
                out.put(k, v);
            }
        });
        return out;
    }

    /**
     * Fold a stage's produced state into this one.
     *
     * @param ownerKey the stage's own output key; the only existing entry that
     *                 may be replaced
     */
    public AgentState mergeStage(AgentState produced, String ownerKey) {
        if (produced == null || produced == this) return this;
        Map<String, Object> changes = diff(produced);
        if (changes.isEmpty()) return this;

        Map<String, Object> next = new LinkedHashMap<>(entries);
        changes.forEach((k, v) -> {
            if (!next.containsKey(k) || k.equals(ownerKey)) {
                next.put(k, v);
            }
        });
        return new AgentState(Collections.unmodifiableMap(next));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AgentState other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() { return entries.hashCode(); }

    @Override
    public String toString() { return "AgentState" + entries.keySet(); }
}
