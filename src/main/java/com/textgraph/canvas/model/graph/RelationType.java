package com.textgraph.canvas.model.graph;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Typed relationship carried by an {@link Edge}.
 *
 * <p>{@link #CO_OCCURRENCE} comes from the parser; the other four are the semantic
 * buckets a {@code SemanticSource} can fill.
 */
public enum RelationType {
    CO_OCCURRENCE("co_occurrence"),
    IS_A("is_a"),
    HAS_ATTRIBUTE("has_attribute"),
    USED_FOR("used_for"),
    RELATED_TO("related_to");

    private static final List<RelationType> SEMANTIC = List.of(IS_A, HAS_ATTRIBUTE, USED_FOR, RELATED_TO);

    private final String wireName;

    RelationType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isSemantic() {
        return this != CO_OCCURRENCE;
    }

    /**
     * The four semantic buckets in their canonical order.
     */
    public static List<RelationType> semanticTypes() {
        return SEMANTIC;
    }

    public static Optional<RelationType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(normalized))
                .findFirst();
    }
}
