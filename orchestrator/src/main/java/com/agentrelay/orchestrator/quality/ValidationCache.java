package com.agentrelay.orchestrator.quality;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * LRU cache of validation results keyed by
 * {@code <content_type>:<mode>:sha256(content[, context])}.
 */
class ValidationCache {

    private final Map<String, ValidationResult> entries;

    ValidationCache(int maxEntries) {
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ValidationResult> eldest) {
                return size() > maxEntries;
            }
        };
    }

    static String key(String content, ContentType type, Map<String, Object> context, boolean strict) {
        StringBuilder material = new StringBuilder(content == null ? "" : content);
        if (context != null && !context.isEmpty()) {
            // sorted so that equal contexts hash equally regardless of map order
            material.append('\u0000').append(new TreeMap<>(context));
        }
        return type.value() + ':' + (strict ? "strict" : "normal") + ':' + sha256(material.toString());
    }

    synchronized ValidationResult get(String key) {
        return entries.get(key);
    }

    synchronized void put(String key, ValidationResult result) {
        entries.put(key, result);
    }

    synchronized int size() {
        return entries.size();
    }

    synchronized void clear() {
        entries.clear();
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
