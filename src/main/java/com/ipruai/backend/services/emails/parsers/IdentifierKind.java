package com.ipruai.backend.services.emails.parsers;

import java.util.Locale;
import java.util.Optional;

/**
 * Identifier kinds, declared from the most to the least specific pattern.
 * Extraction claims text spans in this order so a shorter pattern never re-matches
 * a span already taken by a longer one.
 */
public enum IdentifierKind {

    PAN("pan", "pan_numbers", 40),
    AIF_FOLIO("aif_folio", "aif_folio", 15),
    DI_CODE("di_code", "di_code", 35),
    ACCOUNT_CODE("account_code", "account_code", 10);

    private final String configKey;
    private final String responseKey;
    private final int presenceScore;

    IdentifierKind(String configKey, String responseKey, int presenceScore) {
        this.configKey = configKey;
        this.responseKey = responseKey;
        this.presenceScore = presenceScore;
    }

    public String configKey() {
        return configKey;
    }

    public String responseKey() {
        return responseKey;
    }

    /**
     * Contribution of this kind to the identifier confidence when at least one value is present.
     */
    public int presenceScore() {
        return presenceScore;
    }

    public static Optional<IdentifierKind> fromKey(String key) {
        if (key == null || key.isBlank()) return Optional.empty();
        String k = key.trim().toLowerCase(Locale.ROOT);
        for (IdentifierKind kind : values()) {
            if (kind.configKey.equals(k) || kind.responseKey.equals(k) || kind.name().toLowerCase(Locale.ROOT).equals(k)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
