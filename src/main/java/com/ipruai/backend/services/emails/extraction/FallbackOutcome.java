package com.ipruai.backend.services.emails.extraction;

import com.ipruai.backend.services.emails.quality.ConfidenceScore;

/**
 * Result of the fallback decision: the final fields, their confidence and how they were obtained.
 *
 * @param state final state; a skipped model call ends in {@link FallbackState#RULE_SUFFICIENT}
 * @param attemptedState state chosen from the rule-based score, before any degradation
 * @param mlInvoked the model returned a prediction that took part in the merge
 * @param mlSkipped the state called for the model but it could not be used
 */
public record FallbackOutcome(
        FallbackState state,
        FallbackState attemptedState,
        ParsingMethod parsingMethod,
        ExtractionCandidate candidate,
        ConfidenceScore confidence,
        boolean mlInvoked,
        boolean mlSkipped,
        String mlSkipReason
) {

    static FallbackOutcome ruleOnly(FallbackState state, ExtractionCandidate rule, ConfidenceScore score) {
        return new FallbackOutcome(state, state, ParsingMethod.RULE_BASED, rule, score, false, false, null);
    }

    static FallbackOutcome skipped(FallbackState attempted, ExtractionCandidate rule, ConfidenceScore score, String reason) {
        return new FallbackOutcome(FallbackState.RULE_SUFFICIENT, attempted, ParsingMethod.RULE_BASED,
                rule, score, false, true, reason);
    }
}
