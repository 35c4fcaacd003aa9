package com.ipruai.backend.classification.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ipruai.backend.exceptions.ConfigurationException;
import com.ipruai.backend.services.emails.parsers.FuzzyMatcher;
import com.ipruai.backend.services.emails.parsers.TextNormalizer;

/**
 * Keyword dictionary: category -> statement type -> primary / secondary keywords with weights.
 * Iteration order follows the configuration file so results are deterministic.
 */
public final class StatementKeywordDictionary {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Document(
            Map<String, Map<String, TypeDefinition>> categories,
            List<BulkDefinition> bulkPatterns
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TypeDefinition(
            List<String> primary,
            List<String> secondary,
            Double primaryWeight,
            Double secondaryWeight
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BulkDefinition(List<String> phrases, List<String> categories) {
    }

    public record KeywordRule(String keyword, Pattern pattern, double weight, boolean primary) {
        public boolean matches(String normalizedText) {
            return pattern.matcher(normalizedText).find();
        }

        public List<String> tokens() {
            return FuzzyMatcher.tokens(keyword);
        }
    }

    public record TypeRules(String category, String type, List<KeywordRule> keywords) {
    }

    public record BulkRule(String phrase, Pattern pattern, List<String> categories) {
        public boolean matches(String normalizedText) {
            return pattern.matcher(normalizedText).find();
        }
    }

    private final Map<String, List<TypeRules>> byCategory;
    private final List<BulkRule> bulkRules;

    private StatementKeywordDictionary(Map<String, List<TypeRules>> byCategory, List<BulkRule> bulkRules) {
        this.byCategory = byCategory;
        this.bulkRules = bulkRules;
    }

    public static StatementKeywordDictionary compile(Document document) {
        if (document == null || document.categories() == null || document.categories().isEmpty()) {
            throw new ConfigurationException("statement keyword dictionary has no categories");
        }

        Map<String, List<TypeRules>> byCategory = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, TypeDefinition>> c : document.categories().entrySet()) {
            String category = requireLabel(c.getKey(), "category");
            if (c.getValue() == null || c.getValue().isEmpty()) {
                throw new ConfigurationException("category " + category + " has no statement types");
            }

            List<TypeRules> types = new ArrayList<>();
            for (Map.Entry<String, TypeDefinition> t : c.getValue().entrySet()) {
                String type = requireLabel(t.getKey(), "statement type");
                TypeDefinition def = t.getValue();
                if (def == null) {
                    throw new ConfigurationException("statement type " + category + "/" + type + " has no keywords");
                }
                double primaryWeight = requireWeight(def.primaryWeight(), category, type, "primaryWeight");
                double secondaryWeight = requireWeight(def.secondaryWeight(), category, type, "secondaryWeight");
                if (secondaryWeight > primaryWeight) {
                    throw new ConfigurationException("statement type " + category + "/" + type
                            + ": secondaryWeight must not exceed primaryWeight");
                }

                List<KeywordRule> keywords = new ArrayList<>();
                addKeywords(keywords, def.primary(), primaryWeight, true);
                addKeywords(keywords, def.secondary(), secondaryWeight, false);
                if (keywords.isEmpty()) {
                    throw new ConfigurationException("statement type " + category + "/" + type + " has no keywords");
                }
                types.add(new TypeRules(category, type, List.copyOf(keywords)));
            }
            byCategory.put(category, List.copyOf(types));
        }

        List<BulkRule> bulk = new ArrayList<>();
        if (document.bulkPatterns() != null) {
            for (BulkDefinition def : document.bulkPatterns()) {
                if (def == null || def.phrases() == null || def.categories() == null || def.categories().isEmpty()) {
                    throw new ConfigurationException("bulk pattern needs 'phrases' and 'categories'");
                }
                for (String category : def.categories()) {
                    if (!byCategory.containsKey(category)) {
                        throw new ConfigurationException("bulk pattern refers to unknown category " + category);
                    }
                }
                for (String phrase : def.phrases()) {
                    String normalized = TextNormalizer.normalize(phrase);
                    if (normalized.isEmpty()) continue;
                    bulk.add(new BulkRule(normalized, phrasePattern(normalized), List.copyOf(def.categories())));
                }
            }
        }

        return new StatementKeywordDictionary(Collections.unmodifiableMap(byCategory), List.copyOf(bulk));
    }

    public List<String> categories() {
        return List.copyOf(byCategory.keySet());
    }

    public List<TypeRules> types(String category) {
        return byCategory.getOrDefault(category, List.of());
    }

    public List<TypeRules> allTypes() {
        List<TypeRules> all = new ArrayList<>();
        byCategory.values().forEach(all::addAll);
        return all;
    }

    public boolean contains(String category, String type) {
        return types(category).stream().anyMatch(t -> t.type().equals(type));
    }

    public List<BulkRule> bulkRules() {
        return bulkRules;
    }

    /**
     * Whole-word (or whole-phrase) match that tolerates a plural suffix.
     */
    static Pattern phrasePattern(String normalizedPhrase) {
        return Pattern.compile("(?<![a-z0-9])" + Pattern.quote(normalizedPhrase) + "(?:s|es)?(?![a-z0-9])");
    }

    private static void addKeywords(List<KeywordRule> out, List<String> keywords, double weight, boolean primary) {
        if (keywords == null) return;
        for (String keyword : keywords) {
            String normalized = TextNormalizer.normalize(keyword);
            if (normalized.isEmpty()) continue;
            if (out.stream().anyMatch(k -> k.keyword().equals(normalized))) continue;
            out.add(new KeywordRule(normalized, phrasePattern(normalized), weight, primary));
        }
    }

    private static String requireLabel(String label, String what) {
        if (label == null || label.isBlank()) {
            throw new ConfigurationException(what + " label is blank");
        }
        return label.trim();
    }

    private static double requireWeight(Double weight, String category, String type, String field) {
        if (weight == null || weight <= 0.0 || weight > 1.0) {
            throw new ConfigurationException("statement type " + category + "/" + type + ": "
                    + field + " must be in (0, 1], got " + weight);
        }
        return weight;
    }
}
