package com.agentrelay.orchestrator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link MetricsStore} on Redis. Values are JSON strings; lists are Redis lists
 * with the newest entry at the head.
 *
 * Enabled with {@code agentrelay.store.redis.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "agentrelay.store.redis", name = "enabled", havingValue = "true")
public class RedisMetricsStore implements MetricsStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final StringRedisTemplate redis;
    private final ObjectMapper        json;

    public RedisMetricsStore(StringRedisTemplate redis, ObjectMapper objectMapper) {
        this.redis = redis;
        this.json  = objectMapper;
    }

    @Override
    public void storeMetrics(String key, Map<String, Object> value, long ttlSeconds) {
        try {
            redis.opsForValue().set(key, json.writeValueAsString(value), Duration.ofSeconds(ttlSeconds));
        } catch (JsonProcessingException | DataAccessException e) {
            throw new MetricsStoreException("Failed to store metrics under '" + key + "'", e);
        }
    }

    @Override
    public List<Map<String, Object>> getList(String key) {
        List<String> raw;
        try {
            raw = redis.opsForList().range(key, 0, -1);
        } catch (DataAccessException e) {
            throw new MetricsStoreException("Failed to read list '" + key + "'", e);
        }
        if (raw == null) return List.of();
        List<Map<String, Object>> out = new ArrayList<>(raw.size());
        for (String entry : raw) {
            try {
                out.add(json.readValue(entry, MAP_TYPE));
            } catch (JsonProcessingException e) {
                throw new MetricsStoreException("Corrupt entry in list '" + key + "'", e);
            }
        }
        return out;
    }

    @Override
    public void addToList(String key, Map<String, Object> value, int maxLength) {
        try {
            redis.opsForList().leftPush(key, json.writeValueAsString(value));
            redis.opsForList().trim(key, 0, maxLength - 1L);
        } catch (JsonProcessingException | DataAccessException e) {
            throw new MetricsStoreException("Failed to append to list '" + key + "'", e);
        }
    }
}
