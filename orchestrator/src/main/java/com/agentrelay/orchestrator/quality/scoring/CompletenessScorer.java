package com.agentrelay.orchestrator.quality.scoring;

import com.agentrelay.orchestrator.quality.ContentType;
import com.agentrelay.orchestrator.quality.QualityDimension;
import com.agentrelay.orchestrator.quality.QualityPatterns;
import com.agentrelay.orchestrator.quality.TextFeatures;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Fraction of the elements expected for the content type that are present.
 *
 * <pre>
 *   OPTIMIZATION   numbers, an action, an impact figure, how it is achieved
 *   DATA_ANALYSIS  numbers, a conclusion, a comparison, technical metric
 *   ACTION_PLAN    ordered steps, actions, quantities or commands, verification
 *   REPORT         several sentences, numbers, a conclusion, a recommendation
 *   TRIAGE         category or priority, enough words, technical anchor
 *   ERROR_MESSAGE  what failed, what to do, enough words
 *   GENERAL        enough words, a concrete anchor, terminated sentence
 * </pre>
 */
@Component
public class CompletenessScorer implements DimensionScorer {

    private static final List<String> VERIFICATION = List.of("verify", "validat", "monitor", "measur", "test");
    private static final List<String> TRIAGE_LABELS = List.of("categor", "priority", "intent");
    private static final List<String> FAILURE_WORDS = List.of("error", "fail", "unable", "could not", "timed out");

    @Override
    public QualityDimension dimension() {
        return QualityDimension.COMPLETENESS;
    }

    @Override
    public double score(TextFeatures f, ContentType contentType, Map<String, Object> context) {
        if (f.isBlank()) return 0.0;
        boolean numbers = f.numericValueCount() > 0;
        boolean action  = f.actionVerbCount() > 0;
        boolean enough  = f.wordCount() >= 5;

        boolean[] checks = switch (contentType) {
            case OPTIMIZATION -> new boolean[] {
                    numbers,
                    action,
                    f.percentageCount() > 0 || f.hasComparison() || f.currencyCount() > 0,
                    f.methodConnectorCount() > 0 };
            case DATA_ANALYSIS -> new boolean[] {
                    numbers,
                    QualityPatterns.CONCLUSION.matcher(f.text()).find(),
                    f.hasComparison() || f.percentageCount() > 0,
                    f.technicalTermCount() > 0 };
            case ACTION_PLAN -> new boolean[] {
                    f.hasStepStructure(),
                    action,
                    numbers || f.hasCodeOrCommand(),
                    f.mentionsAny(VERIFICATION) };
            case REPORT -> new boolean[] {
                    f.sentenceCount() >= 2,
                    numbers,
                    QualityPatterns.CONCLUSION.matcher(f.text()).find(),
                    QualityPatterns.RECOMMENDATION.matcher(f.text()).find() };
            case TRIAGE -> new boolean[] {
                    f.mentionsAny(TRIAGE_LABELS),
                    enough,
                    f.technicalTermCount() > 0 || numbers };
            case ERROR_MESSAGE -> new boolean[] {
                    f.mentionsAny(FAILURE_WORDS),
                    action,
                    enough };
            case GENERAL -> new boolean[] {
                    enough,
                    numbers || f.technicalTermCount() > 0,
                    endsTerminated(f.text()) };
        };

        int satisfied = 0;
        for (boolean check : checks) {
            if (check) satisfied++;
        }
        return (double) satisfied / checks.length;
    }

    private static boolean endsTerminated(String text) {
        if (text.isEmpty()) return false;
        return ".!?)]\"".indexOf(text.charAt(text.length() - 1)) >= 0;
    }
}
