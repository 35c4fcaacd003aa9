package com.ipruai.backend.services.emails.parsers;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ipruai.backend.exceptions.ConfigurationException;

/**
 * Compiled identifier patterns, one rule per {@link IdentifierKind}.
 *
 * The search pattern finds candidates in normalized (lower-case) text; the format pattern is the
 * structural invariant every accepted value must satisfy in its canonical upper-case form.
 */
public final class IdentifierRules {

    private static final int MIN_DATE_YEAR = 1990;
    private static final int MAX_DATE_YEAR = 2050;

    private final Map<IdentifierKind, Rule> rules;

    private IdentifierRules(Map<IdentifierKind, Rule> rules) {
        this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PatternDefinition(String pattern, String format, List<String> excluded) {
    }

    public record Rule(IdentifierKind kind, Pattern search, Pattern format, Set<String> excluded) {
    }

    /**
     * Compiles the definitions read from configuration; every kind must be present.
     */
    public static IdentifierRules compile(Map<String, PatternDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new ConfigurationException("identifier patterns are missing");
        }

        Map<IdentifierKind, Rule> compiled = new EnumMap<>(IdentifierKind.class);
        for (Map.Entry<String, PatternDefinition> e : definitions.entrySet()) {
            IdentifierKind kind = IdentifierKind.fromKey(e.getKey())
                    .orElseThrow(() -> new ConfigurationException("unknown identifier kind: " + e.getKey()));
            PatternDefinition def = e.getValue();
            if (def == null || isBlank(def.pattern()) || isBlank(def.format())) {
                throw new ConfigurationException("identifier kind " + kind.configKey() + " needs both 'pattern' and 'format'");
            }
            Set<String> excluded = def.excluded() == null
                    ? Set.of()
                    : def.excluded().stream()
                            .filter(s -> !isBlank(s))
                            .map(s -> s.trim().toUpperCase(Locale.ROOT))
                            .collect(Collectors.toUnmodifiableSet());
            compiled.put(kind, new Rule(
                    kind,
                    compilePattern(kind, def.pattern(), Pattern.CASE_INSENSITIVE),
                    compilePattern(kind, def.format(), 0),
                    excluded));
        }

        for (IdentifierKind kind : IdentifierKind.values()) {
            if (!compiled.containsKey(kind)) {
                throw new ConfigurationException("identifier kind " + kind.configKey() + " is not configured");
            }
        }
        return new IdentifierRules(compiled);
    }

    public Rule rule(IdentifierKind kind) {
        return rules.get(kind);
    }

    /**
     * Canonical form used in results.
     */
    public static String canonical(String value) {
        return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * True when the canonical value satisfies the kind's format, is not a known false positive
     * and passes the kind's plausibility check.
     */
    public boolean isValid(IdentifierKind kind, String value) {
        if (kind == null || value == null) return false;
        Rule rule = rules.get(kind);
        String v = canonical(value);
        if (rule == null || v.isEmpty()) return false;
        if (!rule.format().matcher(v).matches()) return false;
        if (rule.excluded().contains(v)) return false;
        return kind != IdentifierKind.ACCOUNT_CODE || !looksLikeDate(v);
    }

    /**
     * DDMMYYYY or YYYYMMDD forming a real calendar date in the supported year window.
     */
    static boolean looksLikeDate(String digits) {
        if (digits == null || digits.length() != 8 || !digits.chars().allMatch(Character::isDigit)) {
            return false;
        }
        return isDate(digits.substring(4, 8), digits.substring(2, 4), digits.substring(0, 2))
                || isDate(digits.substring(0, 4), digits.substring(4, 6), digits.substring(6, 8));
    }

    private static boolean isDate(String year, String month, String day) {
        int y = Integer.parseInt(year);
        if (y < MIN_DATE_YEAR || y > MAX_DATE_YEAR) return false;
        try {
            LocalDate.of(y, Integer.parseInt(month), Integer.parseInt(day));
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    private static Pattern compilePattern(IdentifierKind kind, String regex, int flags) {
        try {
            return Pattern.compile(regex, flags);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("invalid regex for identifier kind " + kind.configKey() + ": " + regex, e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
