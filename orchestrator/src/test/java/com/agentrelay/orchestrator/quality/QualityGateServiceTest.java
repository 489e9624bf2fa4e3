package com.agentrelay.orchestrator.quality;

import com.agentrelay.orchestrator.quality.scoring.DimensionScorer;
import com.agentrelay.orchestrator.store.MetricsStore;
import com.agentrelay.orchestrator.store.MetricsStoreException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.agentrelay.orchestrator.quality.QualityTestSupport.GENERIC;
import static com.agentrelay.orchestrator.quality.QualityTestSupport.GPU;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Quality gate with the real scorers and no Spring context.
 */
class QualityGateServiceTest {

    private final QualityGateService gate = QualityTestSupport.gate();

    // ------------------------------------------------------------------
    // Pass / fail decisions
    // ------------------------------------------------------------------

    @Test
    void genericContent_failsWithGenericPhrasesAndRetryGuidance() {
        ValidationResult result = gate.validateContent(GENERIC, ContentType.OPTIMIZATION);

        assertThat(result.passed()).isFalse();
        assertThat(result.metrics().genericPhraseCount()).isGreaterThanOrEqualTo(1);
        assertThat(result.retrySuggested()).isTrue();
        assertThat(result.retryPromptAdjustments())
                .containsKeys("focus_dimensions", "additional_instructions", "avoid_phrases")
                .containsEntry("temperature", 0.3);
        assertThat(result.retryPromptAdjustments().get("avoid_phrases"))
                .asInstanceOf(InstanceOfAssertFactories.LIST)
                .contains("generally speaking");
        assertThat(result.metrics().issues()).anyMatch(i -> i.startsWith("Generic phrases"));
    }

    @Test
    void quantifiedContent_passes() {
        ValidationResult result = gate.validateContent(GPU, ContentType.OPTIMIZATION);

        assertThat(result.passed()).isTrue();
        assertThat(result.overallScore()).isGreaterThanOrEqualTo(0.5);
        assertThat(result.metrics().quantificationScore()).isGreaterThan(0.5);
        assertThat(result.retrySuggested()).isFalse();
        assertThat(result.retryPromptAdjustments()).isEmpty();
    }

    @Test
    void emptyContent_isUnacceptableWithFallback() {
        ValidationResult result = gate.validateContent("   ", ContentType.OPTIMIZATION);

        assertThat(result.passed()).isFalse();
        assertThat(result.metrics().qualityLevel()).isEqualTo(QualityLevel.UNACCEPTABLE);
        assertThat(result.fallbackResponse()).contains("optimization");
    }

    @Test
    void strictMode_neverScoresHigherThanNormal() {
        for (String content : List.of(GENERIC, GPU,
                "You could possibly reduce latency, maybe by caching some queries.")) {
            double normal = gate.validateContent(content, ContentType.OPTIMIZATION, Map.of(), false).overallScore();
            double strict = gate.validateContent(content, ContentType.OPTIMIZATION, Map.of(), true).overallScore();
            assertThat(strict).as(content).isLessThanOrEqualTo(normal);
        }
    }

    @Test
    void strictMode_rejectsAnyGenericPhrase() {
        String content = "Moving forward, cache the 20 hottest queries in Redis to cut p95 latency from 800ms to 120ms.";
        ValidationResult strict = gate.validateContent(content, ContentType.GENERAL, Map.of(), true);

        assertThat(strict.passed()).isFalse();
        assertThat(strict.metrics().issues()).contains("Generic phrases are not allowed in strict mode");
    }

    // ------------------------------------------------------------------
    // Cache and history
    // ------------------------------------------------------------------

    @Test
    void cacheHit_returnsIdenticalScore_andIsMuchFaster() {
        String content = (GPU + ". Enable gradient checkpointing with `--grad-ckpt` and batch 32 requests per node. ").repeat(20);

        long coldStart = System.nanoTime();
        ValidationResult first = gate.validateContent(content, ContentType.OPTIMIZATION);
        long cold = System.nanoTime() - coldStart;

        long warmTotal = 0;
        ValidationResult again = null;
        for (int i = 0; i < 10; i++) {
            long start = System.nanoTime();
            again = gate.validateContent(content, ContentType.OPTIMIZATION);
            warmTotal += System.nanoTime() - start;
        }

        assertThat(again).isSameAs(first);
        assertThat(again.overallScore()).isEqualTo(first.overallScore());
        assertThat(warmTotal / 10).isLessThan(cold / 2);
        assertThat(gate.cacheSize()).isEqualTo(1);
    }

    @Test
    void cacheKey_distinguishesTypeModeAndContext() {
        String a = ValidationCache.key(GPU, ContentType.OPTIMIZATION, Map.of(), false);
        assertThat(a).isEqualTo(ValidationCache.key(GPU, ContentType.OPTIMIZATION, Map.of(), false));
        assertThat(a).isNotEqualTo(ValidationCache.key(GPU, ContentType.REPORT, Map.of(), false));
        assertThat(a).isNotEqualTo(ValidationCache.key(GPU, ContentType.OPTIMIZATION, Map.of(), true));
        assertThat(a).isNotEqualTo(ValidationCache.key(GPU, ContentType.OPTIMIZATION,
                Map.of("user_request", "cut GPU memory"), false));
    }

    @Test
    void history_isCappedAtCapacity() {
        for (int i = 0; i < 1001; i++) {
            gate.validateContent(GPU, ContentType.OPTIMIZATION);
        }
        assertThat(gate.historySize(ContentType.OPTIMIZATION)).isEqualTo(1000);
    }

    @Test
    void stats_summariseRecentValidationsPerType() {
        gate.validateContent(GPU, ContentType.OPTIMIZATION);
        gate.validateContent(GENERIC, ContentType.OPTIMIZATION);
        gate.validateContent(GPU, ContentType.REPORT);

        QualityStats stats = gate.getQualityStats(ContentType.OPTIMIZATION);
        assertThat(stats.count()).isEqualTo(2);
        assertThat(stats.maxScore()).isGreaterThan(stats.minScore());
        assertThat(stats.averageScore()).isBetween(stats.minScore(), stats.maxScore());
        assertThat(stats.qualityDistribution().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(2);

        assertThat(gate.getQualityStats().count()).isEqualTo(3);
        assertThat(gate.getQualityStats(ContentType.TRIAGE).count()).isZero();
    }

    // ------------------------------------------------------------------
    // Failure handling
    // ------------------------------------------------------------------

    @Test
    void throwingScorer_isReportedAsValidationError() {
        List<DimensionScorer> scorers = QualityTestSupport.defaultScorers();
        scorers.removeIf(s -> s.dimension() == QualityDimension.NOVELTY);
        scorers.add(new DimensionScorer() {
            @Override public QualityDimension dimension() { return QualityDimension.NOVELTY; }
            @Override public double score(TextFeatures f, ContentType t, Map<String, Object> c) {
                throw new IllegalStateException("novelty model unavailable");
            }
        });
        QualityGateService broken = new QualityGateService(
                new QualityMetricsCalculator(new TextAnalyzer(), scorers),
                null, new SimpleMeterRegistry(), Runnable::run, 10, 10);

        ValidationResult result = broken.validateContent(GPU, ContentType.OPTIMIZATION);

        assertThat(result.passed()).isFalse();
        assertThat(result.retrySuggested()).isFalse();
        assertThat(result.metrics().issues()).singleElement().asString()
                .startsWith("Validation error")
                .contains("novelty model unavailable");
        assertThat(broken.cacheSize()).isZero();
    }

    @Test
    void storeFailure_isLoggedAndIgnored() {
        MetricsStore store = mock(MetricsStore.class);
        doThrow(new MetricsStoreException("redis down", null))
                .when(store).storeMetrics(anyString(), anyMap(), anyLong());
        QualityGateService withStore = new QualityGateService(QualityTestSupport.calculator(),
                store, new SimpleMeterRegistry(), Runnable::run, 10, 10);

        ValidationResult result = withStore.validateContent(GPU, ContentType.OPTIMIZATION);

        assertThat(result.passed()).isTrue();
        verify(store).storeMetrics(eq("quality_metrics:optimization"), anyMap(), eq(86_400L));
        assertThat(withStore.historySize(ContentType.OPTIMIZATION)).isEqualTo(1);
    }

    @Test
    void successfulValidation_isPersistedToStore() {
        MetricsStore store = mock(MetricsStore.class);
        QualityGateService withStore = new QualityGateService(QualityTestSupport.calculator(),
                store, new SimpleMeterRegistry(), Runnable::run, 10, 10);

        withStore.validateContent(GPU, ContentType.OPTIMIZATION);

        verify(store).storeMetrics(eq("quality_metrics:optimization"), anyMap(), eq(86_400L));
        verify(store).addToList(eq("quality_history:optimization"), anyMap(), anyInt());
    }

    // ------------------------------------------------------------------
    // Batch
    // ------------------------------------------------------------------

    @Test
    void validateBatch_preservesInputOrder() {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            QualityGateService concurrent = QualityTestSupport.gate(pool);
            List<ValidationResult> results = concurrent.validateBatch(List.of(
                    new ValidationRequest(GENERIC, ContentType.OPTIMIZATION),
                    new ValidationRequest(GPU, ContentType.OPTIMIZATION),
                    new ValidationRequest(GENERIC, ContentType.OPTIMIZATION),
                    new ValidationRequest(GPU, ContentType.OPTIMIZATION)));

            assertThat(results).extracting(ValidationResult::passed).containsExactly(false, true, false, true);
            assertThat(concurrent.historySize(ContentType.OPTIMIZATION)).isEqualTo(4);
        } finally {
            pool.shutdownNow();
        }
    }
}
