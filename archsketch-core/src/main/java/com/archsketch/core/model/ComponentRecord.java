package com.archsketch.core.model;

import java.util.Objects;

/**
 * A syntax node recognised as a component by the generic classifier.
 *
 * @param name resolved display name, {@code null} if none could be found
 * @param nodeKind kind of the matched node
 * @param span location of the matched node
 */
public record ComponentRecord(
    String name,
    String nodeKind,
    Span span
) {
    /**
     * Compact constructor with validation.
     */
    public ComponentRecord {
        Objects.requireNonNull(nodeKind, "nodeKind must not be null");
        if (span == null) {
            span = Span.EMPTY;
        }
    }
}
