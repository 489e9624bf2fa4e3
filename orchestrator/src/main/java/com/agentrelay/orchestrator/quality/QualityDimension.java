package com.agentrelay.orchestrator.quality;

import java.util.Locale;

/**
 * The seven positive scoring dimensions, each backed by one scorer bean.
 * {@link #instruction()} is the regeneration hint given to an agent whose
 * output scored low on the dimension.
 */
public enum QualityDimension {
    SPECIFICITY("Name concrete components, values and units instead of general statements."),
    ACTIONABILITY("State the exact actions to take, as ordered steps or commands."),
    QUANTIFICATION("Back every claim with a number: current value, target value and expected change."),
    RELEVANCE("Address the user's request directly and drop unrelated material."),
    COMPLETENESS("Cover what is changed, how it is achieved and what impact to expect."),
    NOVELTY("Remove boilerplate and repeated sentences."),
    CLARITY("Use short sentences of at most 25 words.");

    private final String instruction;

    QualityDimension(String instruction) {
        this.instruction = instruction;
    }

    public String instruction() { return instruction; }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
