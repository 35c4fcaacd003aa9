package com.ipruai.backend.services.emails.quality;

import com.ipruai.backend.config.ParserProperties;
import com.ipruai.backend.exceptions.ConfigurationException;

/**
 * Weights of the three confidence sub-scores. They must sum to 1.0.
 */
public record ConfidenceWeights(double statementType, double dateParsing, double identifiers) {

    static final double TOLERANCE = 1e-6;

    public ConfidenceWeights {
        requireRange("statement-type", statementType);
        requireRange("date-parsing", dateParsing);
        requireRange("identifiers", identifiers);
        double sum = statementType + dateParsing + identifiers;
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new ConfigurationException(String.format(
                    "confidence weights must sum to 1.0 (statement-type=%s, date-parsing=%s, identifiers=%s, sum=%s)",
                    statementType, dateParsing, identifiers, sum));
        }
    }

    public static ConfidenceWeights from(ParserProperties.Weights weights) {
        if (weights == null
                || weights.getStatementType() == null
                || weights.getDateParsing() == null
                || weights.getIdentifiers() == null) {
            throw new ConfigurationException(
                    "ipruai.parser.weights.statement-type, date-parsing and identifiers are required");
        }
        return new ConfidenceWeights(weights.getStatementType(), weights.getDateParsing(), weights.getIdentifiers());
    }

    private static void requireRange(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigurationException("confidence weight " + name + " must be within [0, 1], got " + value);
        }
    }
}
