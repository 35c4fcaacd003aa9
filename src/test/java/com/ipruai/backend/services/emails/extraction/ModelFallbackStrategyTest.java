package com.ipruai.backend.services.emails.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.ipruai.backend.config.ParserProperties;
import com.ipruai.backend.exceptions.ConfigurationException;

class ModelFallbackStrategyTest {

    private final ModelFallbackStrategy strategy = new ModelFallbackStrategy(new FallbackThresholds(80, 60));

    @Test
    void decide_transitionsAtThresholds() {
        assertEquals(FallbackState.RULE_SUFFICIENT, strategy.decide(100));
        assertEquals(FallbackState.RULE_SUFFICIENT, strategy.decide(80));
        assertEquals(FallbackState.ML_ENHANCE, strategy.decide(79.99));
        assertEquals(FallbackState.ML_ENHANCE, strategy.decide(60));
        assertEquals(FallbackState.ML_FALLBACK, strategy.decide(59.99));
        assertEquals(FallbackState.ML_FALLBACK, strategy.decide(0));
    }

    @Test
    void stateMapsToParsingMethod() {
        assertEquals(ParsingMethod.RULE_BASED, FallbackState.RULE_SUFFICIENT.parsingMethod());
        assertEquals(ParsingMethod.ML_ENHANCED, FallbackState.ML_ENHANCE.parsingMethod());
        assertEquals(ParsingMethod.ML_FALLBACK, FallbackState.ML_FALLBACK.parsingMethod());
    }

    @Test
    void thresholds_areRequired() {
        ParserProperties.Thresholds missing = new ParserProperties.Thresholds();
        missing.setHigh(80.0);

        assertThrows(ConfigurationException.class, () -> FallbackThresholds.from(missing));
        assertThrows(ConfigurationException.class, () -> FallbackThresholds.from(null));
    }

    @Test
    void thresholds_mediumMustNotExceedHigh() {
        assertThrows(ConfigurationException.class, () -> new FallbackThresholds(60, 80));
        assertThrows(ConfigurationException.class, () -> new FallbackThresholds(120, 60));
    }

    @Test
    void describe_mentionsScore() {
        assertEquals("Model result used as primary (score: 12.50)", strategy.describe(FallbackState.ML_FALLBACK, 12.5));
    }
}
