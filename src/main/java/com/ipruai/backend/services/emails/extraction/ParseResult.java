package com.ipruai.backend.services.emails.extraction;

import java.time.LocalDateTime;

import com.ipruai.backend.classification.StatementSelection;
import com.ipruai.backend.services.emails.parsers.DateRange;
import com.ipruai.backend.services.emails.parsers.IdentifierSet;
import com.ipruai.backend.services.emails.quality.ConfidenceScore;

import lombok.Builder;
import lombok.Value;

/**
 * Final result of parsing one email. A fresh immutable value per call.
 */
@Value
@Builder
public class ParseResult {

    IdentifierSet identifiers;
    DateRange dateRange;
    StatementSelection statements;
    ConfidenceScore confidence;
    ParsingMethod parsingMethod;
    ParseMetadata metadata;
    String rawText;
    LocalDateTime processedAt;
}
