package com.ipruai.backend.services.emails.parsers;

/**
 * Analysis string for one email: lower-cased, accent-free, whitespace-collapsed
 * "subject: ... body: ..." text, plus the combined original text for traceability.
 */
public record NormalizedText(String value, String original) {

    public static final NormalizedText EMPTY = new NormalizedText("", "");

    public NormalizedText {
        value = value == null ? "" : value;
        original = original == null ? "" : original;
    }

    public boolean isEmpty() {
        return value.isBlank();
    }
}
