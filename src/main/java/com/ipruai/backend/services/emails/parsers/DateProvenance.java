package com.ipruai.backend.services.emails.parsers;

/**
 * How a date range was obtained. The confidence feeds the date-parsing sub-score.
 */
public enum DateProvenance {

    EXPLICIT_SINGLE("explicit-single", 95.0),
    EXPLICIT_RANGE("explicit-range", 95.0),
    FISCAL_YEAR("fiscal-year", 95.0),
    RELATIVE("relative", 85.0),
    DEFAULT("default", 0.0);

    private final String tag;
    private final double confidence;

    DateProvenance(String tag, double confidence) {
        this.tag = tag;
        this.confidence = confidence;
    }

    public String tag() {
        return tag;
    }

    public double confidence() {
        return confidence;
    }
}
