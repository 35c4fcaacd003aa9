package com.ipruai.backend.services.emails.quality;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.ipruai.backend.config.ParserProperties;
import com.ipruai.backend.exceptions.ConfigurationException;

class ConfidenceWeightsTest {

    private static ParserProperties.Weights weights(Double statementType, Double dateParsing, Double identifiers) {
        ParserProperties.Weights w = new ParserProperties.Weights();
        w.setStatementType(statementType);
        w.setDateParsing(dateParsing);
        w.setIdentifiers(identifiers);
        return w;
    }

    @Test
    void from_acceptsWeightsSummingToOne() {
        ConfidenceWeights w = ConfidenceWeights.from(weights(0.4, 0.3, 0.3));

        assertEquals(0.4, w.statementType(), 1e-9);
        assertEquals(0.3, w.dateParsing(), 1e-9);
        assertEquals(0.3, w.identifiers(), 1e-9);
    }

    @Test
    void from_rejectsWeightsNotSummingToOne() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> ConfidenceWeights.from(weights(0.5, 0.3, 0.3)));

        assertEquals(true, ex.getMessage().contains("sum to 1.0"));
    }

    @Test
    void from_rejectsMissingWeight() {
        assertThrows(ConfigurationException.class, () -> ConfidenceWeights.from(weights(0.4, null, 0.6)));
        assertThrows(ConfigurationException.class, () -> ConfidenceWeights.from(null));
    }

    @Test
    void constructor_rejectsNegativeWeight() {
        assertThrows(ConfigurationException.class, () -> new ConfidenceWeights(1.2, -0.2, 0.0));
    }
}
