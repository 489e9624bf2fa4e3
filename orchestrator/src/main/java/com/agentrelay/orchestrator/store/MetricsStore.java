package com.agentrelay.orchestrator.store;

import java.util.List;
import java.util.Map;

/**
 * External key/value store for quality metrics and history.
 *
 * Optional: when no bean is present the quality gate keeps metrics in memory
 * only. Implementations may throw {@link MetricsStoreException}; callers log
 * it and carry on.
 */
public interface MetricsStore {

    /** Store {@code value} under {@code key}, expiring after {@code ttlSeconds}. */
    void storeMetrics(String key, Map<String, Object> value, long ttlSeconds);

    /** Most recent first. Empty when the key is unknown. */
    List<Map<String, Object>> getList(String key);

    /** Prepend {@code value} and trim the list to {@code maxLength} entries. */
    void addToList(String key, Map<String, Object> value, int maxLength);
}
