package com.agentrelay.orchestrator.quality;

import java.util.EnumMap;
import java.util.Map;

import static com.agentrelay.orchestrator.quality.QualityDimension.*;

/**
 * Dimension weights and pass thresholds for one {@link ContentType}.
 *
 * Weights of a profile sum to 1.0. A threshold of 0 disables that check.
 */
public record ContentProfile(
        ContentType                   contentType,
        Map<QualityDimension, Double> weights,
        double                        minOverall,
        double                        minSpecificity,
        double                        minActionability) {

    /** Added to every threshold in strict mode. */
    public static final double STRICT_THRESHOLD_BUMP = 0.1;

    private static final Map<ContentType, ContentProfile> PROFILES = new EnumMap<>(ContentType.class);

    static {
        //                                        spec  act   quant rel   comp  nov   clar   overall spec act
        register(ContentType.OPTIMIZATION,  w(0.20, 0.15, 0.20, 0.15, 0.15, 0.05, 0.10), 0.6, 0.5, 0.0);
        register(ContentType.DATA_ANALYSIS, w(0.20, 0.05, 0.25, 0.15, 0.15, 0.10, 0.10), 0.6, 0.4, 0.0);
        register(ContentType.ACTION_PLAN,   w(0.15, 0.30, 0.10, 0.15, 0.15, 0.05, 0.10), 0.6, 0.0, 0.6);
        register(ContentType.REPORT,        w(0.15, 0.15, 0.15, 0.15, 0.20, 0.05, 0.15), 0.5, 0.3, 0.0);
        register(ContentType.TRIAGE,        w(0.10, 0.10, 0.05, 0.30, 0.25, 0.05, 0.15), 0.5, 0.0, 0.0);
        register(ContentType.ERROR_MESSAGE, w(0.10, 0.25, 0.00, 0.20, 0.25, 0.05, 0.15), 0.5, 0.0, 0.3);
        register(ContentType.GENERAL,       w(0.20, 0.15, 0.10, 0.20, 0.15, 0.10, 0.10), 0.5, 0.0, 0.0);
    }

    public static ContentProfile of(ContentType type) {
        return PROFILES.get(type == null ? ContentType.GENERAL : type);
    }

    public double weight(QualityDimension dimension) {
        return weights.getOrDefault(dimension, 0.0);
    }

    public double minOverall(boolean strict) {
        return minOverall + (strict ? STRICT_THRESHOLD_BUMP : 0.0);
    }

    public double minSpecificity(boolean strict) {
        return minSpecificity > 0 ? minSpecificity + (strict ? STRICT_THRESHOLD_BUMP : 0.0) : 0.0;
    }

    public double minActionability(boolean strict) {
        return minActionability > 0 ? minActionability + (strict ? STRICT_THRESHOLD_BUMP : 0.0) : 0.0;
    }

    private static void register(ContentType type, Map<QualityDimension, Double> weights,
                                 double overall, double specificity, double actionability) {
        PROFILES.put(type, new ContentProfile(type, weights, overall, specificity, actionability));
    }

    private static Map<QualityDimension, Double> w(double spec, double act, double quant,
                                                  double rel, double comp, double nov, double clar) {
        Map<QualityDimension, Double> m = new EnumMap<>(QualityDimension.class);
        m.put(SPECIFICITY, spec);
        m.put(ACTIONABILITY, act);
        m.put(QUANTIFICATION, quant);
        m.put(RELEVANCE, rel);
        m.put(COMPLETENESS, comp);
        m.put(NOVELTY, nov);
        m.put(CLARITY, clar);
        return Map.copyOf(m);
    }
}
