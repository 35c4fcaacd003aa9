package com.ipruai.backend.services.emails.extraction;

import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ParseMetadata {

    /** "email" when a date expression was found, "default" otherwise. */
    String dateSource;
    String dateProvenance;
    FallbackState fallbackState;
    /** State picked from the rule-based score; differs from fallbackState when the model was skipped. */
    FallbackState attemptedState;
    boolean mlInvoked;
    boolean mlSkipped;
    String mlSkipReason;
    String modelVersion;
    boolean hasIdentifiers;
    double ruleConfidence;
    long processingTimeMs;
    List<String> businessRules;
}
