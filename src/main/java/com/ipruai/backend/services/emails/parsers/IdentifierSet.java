package com.ipruai.backend.services.emails.parsers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Identifiers found in one email, per kind, in order of first appearance and without duplicates.
 */
public final class IdentifierSet {

    private static final IdentifierSet EMPTY = new IdentifierSet(new EnumMap<>(IdentifierKind.class));

    private final Map<IdentifierKind, List<String>> values;

    private IdentifierSet(Map<IdentifierKind, List<String>> values) {
        EnumMap<IdentifierKind, List<String>> copy = new EnumMap<>(IdentifierKind.class);
        for (IdentifierKind kind : IdentifierKind.values()) {
            List<String> list = values.get(kind);
            copy.put(kind, list == null ? List.of() : List.copyOf(list));
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public static IdentifierSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> get(IdentifierKind kind) {
        return values.get(kind);
    }

    public Map<IdentifierKind, List<String>> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return totalCount() == 0;
    }

    public boolean has(IdentifierKind kind) {
        return !values.get(kind).isEmpty();
    }

    public int totalCount() {
        return values.values().stream().mapToInt(List::size).sum();
    }

    public int distinctKinds() {
        return (int) values.values().stream().filter(l -> !l.isEmpty()).count();
    }

    /**
     * Values of this set first, then the other set's values not already present.
     */
    public IdentifierSet union(IdentifierSet other) {
        if (other == null || other.isEmpty()) return this;
        Builder b = builder().addAll(this);
        return b.addAll(other).build();
    }

    /**
     * Keeps only the values accepted by the predicate.
     */
    public IdentifierSet filter(BiPredicate<IdentifierKind, String> accept) {
        Builder b = builder();
        for (Map.Entry<IdentifierKind, List<String>> e : values.entrySet()) {
            for (String v : e.getValue()) {
                if (accept.test(e.getKey(), v)) b.add(e.getKey(), v);
            }
        }
        return b.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdentifierSet other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "IdentifierSet" + values;
    }

    public static final class Builder {

        private final EnumMap<IdentifierKind, Set<String>> values = new EnumMap<>(IdentifierKind.class);

        private Builder() {
        }

        public Builder add(IdentifierKind kind, String value) {
            if (kind == null || value == null || value.isBlank()) return this;
            values.computeIfAbsent(kind, k -> new LinkedHashSet<>()).add(value);
            return this;
        }

        public Builder addAll(IdentifierSet set) {
            if (set == null) return this;
            set.values.forEach((kind, list) -> list.forEach(v -> add(kind, v)));
            return this;
        }

        public IdentifierSet build() {
            EnumMap<IdentifierKind, List<String>> out = new EnumMap<>(IdentifierKind.class);
            values.forEach((kind, set) -> out.put(kind, new ArrayList<>(set)));
            return new IdentifierSet(out);
        }
    }
}
