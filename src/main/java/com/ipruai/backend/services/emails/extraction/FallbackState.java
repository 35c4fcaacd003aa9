package com.ipruai.backend.services.emails.extraction;

/**
 * Outcome of comparing the rule-based confidence against the fallback thresholds.
 */
public enum FallbackState {

    /** Score at or above the high threshold; the model is not called. */
    RULE_SUFFICIENT(ParsingMethod.RULE_BASED),

    /** Score between the thresholds; the model enriches or confirms the rule-based labels. */
    ML_ENHANCE(ParsingMethod.ML_ENHANCED),

    /** Score below the medium threshold; the model output is primary. */
    ML_FALLBACK(ParsingMethod.ML_FALLBACK);

    private final ParsingMethod parsingMethod;

    FallbackState(ParsingMethod parsingMethod) {
        this.parsingMethod = parsingMethod;
    }

    /**
     * Parsing method reported when this state's path was taken successfully.
     */
    public ParsingMethod parsingMethod() {
        return parsingMethod;
    }

    public boolean callsModel() {
        return this != RULE_SUFFICIENT;
    }
}
