package com.archsketch.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Directed relationship between two components, identified by name.
 *
 * <p>The target name is absent when the enclosed component's name could not be resolved;
 * such relationships are kept in the raw list but contribute no target node.
 *
 * @param from name of the enclosing component
 * @param to name of the enclosed component, {@code null} if unresolved
 * @param kind relationship kind
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record Relationship(
    String from,
    String to,
    RelationshipKind kind
) {
    /**
     * Compact constructor with validation.
     */
    public Relationship {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Creates a containment relationship.
     *
     * @param from enclosing component name
     * @param to enclosed component name, may be {@code null}
     * @return relationship of kind {@link RelationshipKind#CONTAINS}
     */
    public static Relationship contains(String from, String to) {
        return new Relationship(from, to, RelationshipKind.CONTAINS);
    }
}
