package com.ipruai.backend.services.emails.extraction;

import com.ipruai.backend.config.ParserProperties;
import com.ipruai.backend.exceptions.ConfigurationException;

/**
 * Confidence thresholds of the fallback state machine, both on the 0-100 scale.
 */
public record FallbackThresholds(double high, double medium) {

    public FallbackThresholds {
        if (high < 0 || high > 100 || medium < 0 || medium > 100) {
            throw new ConfigurationException("fallback thresholds must be within [0, 100] (high=" + high + ", medium=" + medium + ")");
        }
        if (medium > high) {
            throw new ConfigurationException("medium threshold " + medium + " is above high threshold " + high);
        }
    }

    public static FallbackThresholds from(ParserProperties.Thresholds thresholds) {
        if (thresholds == null || thresholds.getHigh() == null || thresholds.getMedium() == null) {
            throw new ConfigurationException("ipruai.parser.thresholds.high and ipruai.parser.thresholds.medium are required");
        }
        return new FallbackThresholds(thresholds.getHigh(), thresholds.getMedium());
    }
}
