package com.agentrelay.orchestrator.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RedisMetricsStore against a mocked template; no Redis server needed.
 */
@ExtendWith(MockitoExtension.class)
class RedisMetricsStoreTest {

    @Mock StringRedisTemplate redis;
    @Mock ValueOperations<String, String> values;
    @Mock ListOperations<String, String> lists;

    private RedisMetricsStore store;

    @BeforeEach
    void setUp() {
        store = new RedisMetricsStore(redis, new ObjectMapper());
    }

    @Test
    void storeMetrics_writesJsonWithTtl() {
        when(redis.opsForValue()).thenReturn(values);

        store.storeMetrics("quality_metrics:abc", Map.of("overall_score", 0.8), 86_400);

        verify(values).set("quality_metrics:abc", "{\"overall_score\":0.8}", Duration.ofSeconds(86_400));
    }

    @Test
    void addToList_pushesToHeadAndTrims() {
        when(redis.opsForList()).thenReturn(lists);

        store.addToList("quality_history:optimization", Map.of("passed", true), 1000);

        verify(lists).leftPush("quality_history:optimization", "{\"passed\":true}");
        verify(lists).trim("quality_history:optimization", 0, 999);
    }

    @Test
    void getList_decodesEntriesInOrder() {
        when(redis.opsForList()).thenReturn(lists);
        when(lists.range("k", 0, -1)).thenReturn(List.of("{\"n\":2}", "{\"n\":1}"));

        assertThat(store.getList("k")).extracting(m -> m.get("n")).containsExactly(2, 1);
    }

    @Test
    void getList_missingKey_returnsEmpty() {
        when(redis.opsForList()).thenReturn(lists);
        when(lists.range("k", 0, -1)).thenReturn(null);

        assertThat(store.getList("k")).isEmpty();
    }

    @Test
    void getList_corruptEntry_throwsStoreException() {
        when(redis.opsForList()).thenReturn(lists);
        when(lists.range("k", 0, -1)).thenReturn(List.of("not json"));

        assertThatThrownBy(() -> store.getList("k"))
                .isInstanceOf(MetricsStoreException.class)
                .hasMessageContaining("Corrupt entry");
    }

    @Test
    void storeMetrics_redisFailure_wrappedInStoreException() {
        when(redis.opsForValue()).thenReturn(values);
        doThrow(new QueryTimeoutException("redis down"))
                .when(values).set(anyString(), anyString(), any(Duration.class));

        assertThatThrownBy(() -> store.storeMetrics("k", Map.of("a", 1), 60))
                .isInstanceOf(MetricsStoreException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class);
    }
}
