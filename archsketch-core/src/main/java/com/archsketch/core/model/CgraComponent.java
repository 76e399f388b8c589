package com.archsketch.core.model;

import java.util.Objects;

/**
 * Component typed by the CGRA taxonomy, with its extracted interface.
 *
 * @param category CGRA category chosen by priority
 * @param name node text that triggered the match
 * @param nodeKind kind of the matched node
 * @param span location of the matched node
 * @param iface interface shape, empty for non struct/interface nodes
 */
public record CgraComponent(
    CgraComponentCategory category,
    String name,
    String nodeKind,
    Span span,
    InterfaceDescriptor iface
) {
    /**
     * Compact constructor with validation.
     */
    public CgraComponent {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(nodeKind, "nodeKind must not be null");
        if (span == null) {
            span = Span.EMPTY;
        }
        if (iface == null) {
            iface = InterfaceDescriptor.empty();
        }
    }
}
