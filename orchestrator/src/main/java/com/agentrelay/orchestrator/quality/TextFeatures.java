package com.agentrelay.orchestrator.quality;

import java.util.List;

/**
 * Lexical features extracted once per validation and shared by all
 * dimension scorers.
 */
public record TextFeatures(
        String       text,
        String       lowerText,
        List<String> words,
        List<String> sentences,
        int          numericValueCount,
        int          unitValueCount,
        int          percentageCount,
        int          currencyCount,
        boolean      hasComparison,
        int          technicalTermCount,
        int          actionVerbCount,
        int          hedgeCount,
        int          vagueTermCount,
        List<String> genericPhrases,
        int          stepMarkerCount,
        boolean      hasCodeOrCommand,
        int          methodConnectorCount,
        boolean      circularReasoning,
        double       hallucinationRisk,
        double       redundancyRatio) {

    public int wordCount()            { return words.size(); }
    public int sentenceCount()        { return sentences.size(); }
    public int genericPhraseCount()   { return genericPhrases.size(); }
    public boolean hasStepStructure() { return stepMarkerCount >= 2; }

    public boolean isBlank() {
        return words.isEmpty();
    }

    public double averageSentenceLength() {
        return sentences.isEmpty() ? 0.0 : (double) words.size() / sentences.size();
    }

    /** True when the text mentions any of the given lower-case stems. */
    public boolean mentionsAny(List<String> stems) {
        for (String stem : stems) {
            if (lowerText.contains(stem)) return true;
        }
        return false;
    }

    public int countMentions(List<String> stems) {
        int n = 0;
        for (String stem : stems) {
            if (lowerText.contains(stem)) n++;
        }
        return n;
    }
}
