package com.ipruai.backend.services.emails.quality;

/**
 * Overall confidence (0-100) and the sub-scores it was computed from.
 *
 * @param modelConfidence statistical classifier confidence that took part in the statement
 *                        sub-score, or {@code null} when the model was not used
 */
public record ConfidenceScore(
        double overall,
        double statementType,
        double dateParsing,
        double identifiers,
        Double modelConfidence
) {
}
