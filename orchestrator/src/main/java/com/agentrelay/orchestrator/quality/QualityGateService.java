package com.agentrelay.orchestrator.quality;

import com.agentrelay.orchestrator.store.MetricsStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Quality gate for agent output.
 *
 * <p>Each validation:
 * <ol>
 *   <li>looks up the result cache (content type, mode and content hash);</li>
 *   <li>on a miss, scores the content with {@link QualityMetricsCalculator} and
 *       applies the content type's pass thresholds;</li>
 *   <li>appends the metrics to the per-type history;</li>
 *   <li>persists them to the {@link MetricsStore} under
 *       {@code quality_metrics:<content_type>} with a 24 h expiry, if a store
 *       is configured.</li>
 * </ol>
 *
 * <p>Never throws for bad content or a failing scorer: such a validation comes
 * back with {@code passed=false} and a "Validation error" issue. Store errors
 * are logged and ignored.
 */
public class QualityGateService {

    private static final Logger log = LoggerFactory.getLogger(QualityGateService.class);

    public static final String METRICS_KEY_PREFIX = "quality_metrics:";
    public static final String HISTORY_KEY_PREFIX = "quality_history:";
    public static final long   METRICS_TTL_SECONDS = 24 * 60 * 60;
    public static final int    STATS_WINDOW = 100;

    private static final double MAX_HALLUCINATION_RISK = 0.7;

    private final QualityMetricsCalculator calculator;
    private final MetricsStore             store;
    private final MeterRegistry            meterRegistry;
    private final Executor                 batchExecutor;
    private final ValidationCache          cache;
    private final QualityHistory           history;
    private final int                      historySize;

    /**
     * @param store may be null; metrics then stay in memory only
     */
    public QualityGateService(QualityMetricsCalculator calculator,
                              MetricsStore store,
                              MeterRegistry meterRegistry,
                              Executor batchExecutor,
                              int cacheSize,
                              int historySize) {
        this.calculator    = calculator;
        this.store         = store;
        this.meterRegistry = meterRegistry;
        this.batchExecutor = batchExecutor;
        this.cache         = new ValidationCache(cacheSize);
        this.history       = new QualityHistory(historySize);
        this.historySize   = historySize;
        if (store == null) {
            log.info("No metrics store configured, quality metrics are kept in memory only");
        }
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    public ValidationResult validateContent(String content, ContentType contentType) {
        return validateContent(content, contentType, Map.of(), false);
    }

    public ValidationResult validate(ValidationRequest request) {
        return validateContent(request.content(), request.contentType(), request.context(), request.strictMode());
    }

    public ValidationResult validateContent(String content, ContentType contentType,
                                            Map<String, Object> context, boolean strictMode) {
        ContentType type = contentType == null ? ContentType.GENERAL : contentType;
        Map<String, Object> ctx = context == null ? Map.of() : context;

        String key = ValidationCache.key(content, type, ctx, strictMode);
        ValidationResult cached = cache.get(key);
        if (cached != null) {
            history.record(type, cached.metrics());
            count(type, "cached");
            return cached;
        }

        ValidationResult result;
        try {
            QualityMetrics metrics = calculator.calculate(content, type, ctx, strictMode);
            result = decide(content, type, metrics, strictMode);
        } catch (RuntimeException e) {
            log.warn("Quality validation of {} content failed: {}", type.value(), e.getMessage(), e);
            QualityMetrics failed = QualityMetrics.failed("Validation error: " + e.getMessage());
            history.record(type, failed);
            count(type, "error");
            return new ValidationResult(false, failed, false, Map.of(), null);
        }

        cache.put(key, result);
        history.record(type, result.metrics());
        persist(type, result.metrics());
        count(type, result.passed() ? "passed" : "failed");

        log.debug("Validated {} content: score={} level={} passed={}",
                type.value(), result.overallScore(), result.metrics().qualityLevel().value(), result.passed());
        return result;
    }

    /**
     * Validates all items concurrently. The i-th result belongs to the i-th
     * request regardless of completion order.
     */
    public List<ValidationResult> validateBatch(List<ValidationRequest> requests) {
        List<CompletableFuture<ValidationResult>> futures = requests.stream()
                .map(r -> CompletableFuture.supplyAsync(() -> validate(r), batchExecutor))
                .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    // ------------------------------------------------------------------
    // Stats
    // ------------------------------------------------------------------

    /** Summary of the last {@value #STATS_WINDOW} validations of {@code contentType}. */
    public QualityStats getQualityStats(ContentType contentType) {
        return history.stats(contentType, STATS_WINDOW);
    }

    /** Summary over the last {@value #STATS_WINDOW} validations of every type. */
    public QualityStats getQualityStats() {
        return history.stats(null, STATS_WINDOW);
    }

    public int historySize(ContentType contentType) {
        return history.size(contentType);
    }

    public int cacheSize() {
        return cache.size();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ValidationResult decide(String content, ContentType type, QualityMetrics metrics, boolean strict) {
        ContentProfile profile = ContentProfile.of(type);

        List<String> failures = new ArrayList<>();
        if (metrics.overallScore() < profile.minOverall(strict)) {
            failures.add("Overall score %.2f below %.2f".formatted(metrics.overallScore(), profile.minOverall(strict)));
        }
        if (metrics.specificityScore() < profile.minSpecificity(strict)) {
            failures.add("Specificity %.2f below %.2f".formatted(metrics.specificityScore(), profile.minSpecificity(strict)));
        }
        if (metrics.actionabilityScore() < profile.minActionability(strict)) {
            failures.add("Actionability %.2f below %.2f".formatted(metrics.actionabilityScore(), profile.minActionability(strict)));
        }
        if (metrics.hallucinationRisk() >= MAX_HALLUCINATION_RISK) {
            failures.add("Hallucination risk %.2f too high".formatted(metrics.hallucinationRisk()));
        }
        if (strict && metrics.genericPhraseCount() > 0) {
            failures.add("Generic phrases are not allowed in strict mode");
        }

        if (failures.isEmpty()) {
            return new ValidationResult(true, metrics, false, Map.of(), null);
        }
        QualityMetrics annotated = metrics.withFindings(failures, List.of());
        return new ValidationResult(false, annotated, true,
                RetryGuidance.adjustments(annotated, profile, content, strict),
                RetryGuidance.fallback(annotated, type));
    }

    private void persist(ContentType type, QualityMetrics metrics) {
        if (store == null) return;
        Map<String, Object> record = new LinkedHashMap<>(metrics.toMap());
        record.put("content_type", type.value());
        record.put("timestamp", Instant.now().toString());
        try {
            store.storeMetrics(METRICS_KEY_PREFIX + type.value(), record, METRICS_TTL_SECONDS);
            store.addToList(HISTORY_KEY_PREFIX + type.value(), record, historySize);
        } catch (RuntimeException e) {
            log.warn("Could not persist quality metrics for {}: {}", type.value(), e.getMessage());
        }
    }

    private void count(ContentType type, String outcome) {
        meterRegistry.counter("agentrelay.quality.validations",
                "content_type", type.value(), "outcome", outcome).increment();
    }
}
