package com.agentrelay.orchestrator.quality.scoring;

import com.agentrelay.orchestrator.quality.ContentType;
import com.agentrelay.orchestrator.quality.QualityDimension;
import com.agentrelay.orchestrator.quality.QualityPatterns;
import com.agentrelay.orchestrator.quality.TextFeatures;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Overlap with the user's request when the caller supplies one
 * ({@code user_request} or {@code query} in the context), otherwise the
 * density of vocabulary expected for the content type.
 */
@Component
public class RelevanceScorer implements DimensionScorer {

    private static final Map<ContentType, List<String>> DOMAIN_KEYWORDS = Map.of(
            ContentType.OPTIMIZATION, List.of("optimi", "reduc", "latency", "memory", "cost", "throughput",
                    "performance", "gpu", "cpu", "efficien", "utiliz", "saving", "speed", "faster", "cache"),
            ContentType.DATA_ANALYSIS, List.of("data", "metric", "trend", "analy", "average", "median",
                    "p95", "p99", "percent", "distribution", "correlat", "usage", "sample"),
            ContentType.ACTION_PLAN, List.of("step", "implement", "deploy", "configur", "owner", "timeline",
                    "rollout", "verify", "monitor", "migrat"),
            ContentType.REPORT, List.of("summary", "finding", "result", "recommend", "impact", "overview",
                    "conclusion", "next step"),
            ContentType.TRIAGE, List.of("categor", "priority", "intent", "request", "requires", "data",
                    "optimization", "classif", "confidence"),
            ContentType.ERROR_MESSAGE, List.of("error", "fail", "retry", "cause", "try", "check", "unable",
                    "timeout"),
            ContentType.GENERAL, List.of());

    @Override
    public QualityDimension dimension() {
        return QualityDimension.RELEVANCE;
    }

    @Override
    public double score(TextFeatures f, ContentType contentType, Map<String, Object> context) {
        Object request = context.getOrDefault("user_request", context.get("query"));
        if (request != null && !request.toString().isBlank()) {
            Set<String> wanted = stems(request.toString());
            if (!wanted.isEmpty()) {
                Set<String> have = stems(f.lowerText());
                long hits = wanted.stream().filter(have::contains).count();
                return DimensionScorer.clamp(0.3 + 0.7 * hits / wanted.size());
            }
        }
        List<String> keywords = DOMAIN_KEYWORDS.getOrDefault(contentType, List.of());
        return DimensionScorer.clamp(0.5 + 0.1 * f.countMentions(keywords));
    }

    private static Set<String> stems(String text) {
        Set<String> out = new LinkedHashSet<>();
        for (String raw : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (raw.length() <= 3 || QualityPatterns.STOPWORDS.contains(raw)) continue;
            out.add(raw.length() > 5 ? raw.substring(0, 5) : raw);
        }
        return out;
    }
}
