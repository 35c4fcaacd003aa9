package com.ipruai.backend.classification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Selected statement categories and, per category, the selected types with their accumulated
 * match weight (0..1). Immutable; insertion order is preserved.
 */
public final class StatementSelection {

    public static final double MAX_WEIGHT = 1.0;

    private static final StatementSelection EMPTY = new StatementSelection(Map.of());

    private final Map<String, Map<String, Double>> weights;

    private StatementSelection(Map<String, Map<String, Double>> weights) {
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        weights.forEach((category, types) -> {
            if (types != null && !types.isEmpty()) {
                copy.put(category, Collections.unmodifiableMap(new LinkedHashMap<>(types)));
            }
        });
        this.weights = Collections.unmodifiableMap(copy);
    }

    public static StatementSelection empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    public List<String> categories() {
        return List.copyOf(weights.keySet());
    }

    /**
     * All selected types, category by category.
     */
    public List<String> types() {
        List<String> all = new ArrayList<>();
        weights.values().forEach(t -> all.addAll(t.keySet()));
        return all;
    }

    public Map<String, Double> typesOf(String category) {
        return weights.getOrDefault(category, Map.of());
    }

    public boolean contains(String category, String type) {
        return typesOf(category).containsKey(type);
    }

    public double weight(String category, String type) {
        return typesOf(category).getOrDefault(type, 0.0);
    }

    public double maxWeight() {
        return weights.values().stream()
                .flatMap(t -> t.values().stream())
                .mapToDouble(Double::doubleValue)
                .max()
                .orElse(0.0);
    }

    public double maxWeight(String category) {
        return typesOf(category).values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }

    public StatementSelection withoutCategory(String category) {
        if (!weights.containsKey(category)) return this;
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>(weights);
        copy.remove(category);
        return new StatementSelection(copy);
    }

    public Map<String, Map<String, Double>> asMap() {
        return weights;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatementSelection other)) return false;
        return weights.equals(other.weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "StatementSelection" + weights;
    }

    public static final class Builder {

        private final Map<String, Map<String, Double>> weights = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds a keyword hit; the running total is capped after each addition.
         */
        public Builder accumulate(String category, String type, double weight) {
            Map<String, Double> types = weights.computeIfAbsent(category, c -> new LinkedHashMap<>());
            double current = types.getOrDefault(type, 0.0);
            types.put(type, Math.min(MAX_WEIGHT, current + Math.max(0.0, weight)));
            return this;
        }

        /**
         * Keeps the higher of the existing and the given weight.
         */
        public Builder putMax(String category, String type, double weight) {
            Map<String, Double> types = weights.computeIfAbsent(category, c -> new LinkedHashMap<>());
            double capped = Math.min(MAX_WEIGHT, Math.max(0.0, weight));
            types.merge(type, capped, Math::max);
            return this;
        }

        public Builder putAll(String category, Map<String, Double> types) {
            if (types != null) types.forEach((type, w) -> putMax(category, type, w));
            return this;
        }

        public StatementSelection build() {
            return weights.isEmpty() ? EMPTY : new StatementSelection(weights);
        }
    }
}
