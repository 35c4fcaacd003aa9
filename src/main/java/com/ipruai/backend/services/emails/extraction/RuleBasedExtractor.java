package com.ipruai.backend.services.emails.extraction;

import java.util.List;

import org.springframework.stereotype.Component;

import com.ipruai.backend.classification.StatementClassifier;
import com.ipruai.backend.services.emails.parsers.DateRangeResolver;
import com.ipruai.backend.services.emails.parsers.IdentifierExtractor;
import com.ipruai.backend.services.emails.parsers.NormalizedText;

import lombok.RequiredArgsConstructor;

/**
 * Deterministic extraction: identifiers, date range and statement selection, each computed
 * independently from the same normalized text.
 */
@Component
@RequiredArgsConstructor
public class RuleBasedExtractor {

    private final IdentifierExtractor identifierExtractor;
    private final DateRangeResolver dateRangeResolver;
    private final StatementClassifier statementClassifier;
    private final StatementEligibilityPolicy eligibilityPolicy;

    public ExtractionCandidate extract(NormalizedText text) {
        ExtractionCandidate candidate = new ExtractionCandidate(
                identifierExtractor.extract(text),
                dateRangeResolver.resolve(text),
                statementClassifier.classify(text),
                List.of());
        return eligibilityPolicy.apply(candidate);
    }
}
