package com.ipruai.backend.services.emails.extraction;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ParsingMethod {

    RULE_BASED("rule_based"),
    ML_ENHANCED("ml_enhanced"),
    ML_FALLBACK("ml_fallback");

    private final String value;

    ParsingMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
