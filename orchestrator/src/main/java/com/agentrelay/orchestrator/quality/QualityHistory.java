package com.agentrelay.orchestrator.quality;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-content-type ring of recent validation metrics. Each deque is bounded
 * at {@code capacity}; appending to a full deque evicts the oldest entry.
 * Appends and reads of one deque are serialised on that deque.
 */
class QualityHistory {

    private final int capacity;
    private final Map<ContentType, Deque<QualityMetrics>> byType = new ConcurrentHashMap<>();

    QualityHistory(int capacity) {
        this.capacity = capacity;
    }

    void record(ContentType type, QualityMetrics metrics) {
        Deque<QualityMetrics> deque = byType.computeIfAbsent(type, t -> new ArrayDeque<>());
        synchronized (deque) {
            if (deque.size() >= capacity) deque.removeFirst();
            deque.addLast(metrics);
        }
    }

    int size(ContentType type) {
        Deque<QualityMetrics> deque = byType.get(type);
        if (deque == null) return 0;
        synchronized (deque) {
            return deque.size();
        }
    }

    /** Up to {@code limit} most recent entries, newest last. */
    List<QualityMetrics> recent(ContentType type, int limit) {
        Deque<QualityMetrics> deque = byType.get(type);
        if (deque == null) return List.of();
        List<QualityMetrics> out = new ArrayList<>(Math.min(limit, capacity));
        synchronized (deque) {
            Iterator<QualityMetrics> it = deque.descendingIterator();
            while (it.hasNext() && out.size() < limit) out.add(it.next());
        }
        Collections.reverse(out);
        return out;
    }

    QualityStats stats(ContentType type, int window) {
        List<QualityMetrics> entries = type != null ? recent(type, window) : recentAcrossTypes(window);
        if (entries.isEmpty()) return QualityStats.empty(type);

        double min = Double.MAX_VALUE, max = -Double.MAX_VALUE, sum = 0.0;
        Map<QualityLevel, Integer> distribution = new EnumMap<>(QualityLevel.class);
        for (QualityMetrics m : entries) {
            double s = m.overallScore();
            min = Math.min(min, s);
            max = Math.max(max, s);
            sum += s;
            distribution.merge(m.qualityLevel(), 1, Integer::sum);
        }
        return new QualityStats(type, entries.size(), min, max, sum / entries.size(), Map.copyOf(distribution));
    }

    private List<QualityMetrics> recentAcrossTypes(int window) {
        List<QualityMetrics> all = new ArrayList<>();
        for (ContentType t : ContentType.values()) {
            all.addAll(recent(t, window));
        }
        return all;
    }
}
