package com.textgraph.canvas.model.semantic;

import com.google.common.base.Preconditions;
import com.textgraph.canvas.model.graph.RelationType;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable answer of a semantic source for one word: up to four buckets
 * (is_a, has_attribute, used_for, related_to) of normalized terms.
 *
 * <p>Terms keep the order in which the source produced them. Blank terms and
 * terms equal to nothing but punctuation are dropped on insertion.
 */
public final class RelationshipSet {

    private static final RelationshipSet EMPTY = new RelationshipSet(new EnumMap<>(RelationType.class));

    private final Map<RelationType, Set<String>> buckets;

    private RelationshipSet(Map<RelationType, Set<String>> buckets) {
        this.buckets = buckets;
    }

    public static RelationshipSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Lower-cases, trims and collapses inner whitespace. Returns an empty string
     * for input that carries no letters or digits.
     */
    public static String normalizeTerm(String term) {
        if (term == null) {
            return "";
        }
        String normalized = term.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ")
                .replaceAll("^[\\p{Punct}\\s]+|[\\p{Punct}\\s]+$", "");
        return normalized.codePoints().anyMatch(Character::isLetterOrDigit) ? normalized : "";
    }

    public Set<String> get(RelationType type) {
        return buckets.getOrDefault(type, Collections.emptySet());
    }

    public Set<String> getIsA() {
        return get(RelationType.IS_A);
    }

    public Set<String> getHasAttribute() {
        return get(RelationType.HAS_ATTRIBUTE);
    }

    public Set<String> getUsedFor() {
        return get(RelationType.USED_FOR);
    }

    public Set<String> getRelatedTo() {
        return get(RelationType.RELATED_TO);
    }

    public boolean isEmpty() {
        return buckets.values().stream().allMatch(Set::isEmpty);
    }

    public int size() {
        return buckets.values().stream().mapToInt(Set::size).sum();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RelationshipSet)) return false;
        return buckets.equals(((RelationshipSet) o).buckets);
    }

    @Override
    public int hashCode() {
        return buckets.hashCode();
    }

    @Override
    public String toString() {
        return "RelationshipSet" + buckets;
    }

    public static final class Builder {

        private final Map<RelationType, Set<String>> buckets = new EnumMap<>(RelationType.class);

        private Builder() {
        }

        public Builder add(RelationType type, String term) {
            Preconditions.checkNotNull(type, "type cannot be null");
            Preconditions.checkArgument(type.isSemantic(), "co_occurrence is not a semantic relation");
            String normalized = normalizeTerm(term);
            if (!normalized.isEmpty()) {
                buckets.computeIfAbsent(type, t -> new LinkedHashSet<>()).add(normalized);
            }
            return this;
        }

        public Builder addAll(RelationType type, Collection<String> terms) {
            if (terms != null) {
                terms.forEach(term -> add(type, term));
            }
            return this;
        }

        public Builder isA(String... terms) {
            return addAll(RelationType.IS_A, Arrays.asList(terms));
        }

        public Builder hasAttribute(String... terms) {
            return addAll(RelationType.HAS_ATTRIBUTE, Arrays.asList(terms));
        }

        public Builder usedFor(String... terms) {
            return addAll(RelationType.USED_FOR, Arrays.asList(terms));
        }

        public Builder relatedTo(String... terms) {
            return addAll(RelationType.RELATED_TO, Arrays.asList(terms));
        }

        public RelationshipSet build() {
            if (buckets.isEmpty()) {
                return EMPTY;
            }
            Map<RelationType, Set<String>> frozen = new EnumMap<>(RelationType.class);
            buckets.forEach((type, terms) -> frozen.put(type, Collections.unmodifiableSet(new LinkedHashSet<>(terms))));
            return new RelationshipSet(Collections.unmodifiableMap(frozen));
        }
    }
}
