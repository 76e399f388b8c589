package com.archsketch.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Occurrence of a control-flow, data-flow or state pattern in a syntax tree.
 *
 * @param category category the node matched
 * @param name resolved display name, {@code null} if none
 * @param nodeKind kind of the matched node
 * @param span location of the matched node
 * @param direction data-flow direction; only set for {@link PatternCategory#DATA_FLOW}
 */
public record FlowPattern(
    PatternCategory category,
    String name,
    String nodeKind,
    Span span,
    @JsonInclude(JsonInclude.Include.NON_NULL) FlowDirection direction
) {
    /**
     * Compact constructor with validation.
     */
    public FlowPattern {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(nodeKind, "nodeKind must not be null");
        if (span == null) {
            span = Span.EMPTY;
        }
        if (category != PatternCategory.DATA_FLOW && direction != null) {
            throw new IllegalArgumentException("direction is only defined for data-flow patterns");
        }
    }
}
