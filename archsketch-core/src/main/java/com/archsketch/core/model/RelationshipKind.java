package com.archsketch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of relationships between components.
 */
public enum RelationshipKind {
    /** The source component's subtree encloses the target's declaration. */
    CONTAINS;

    @JsonValue
    public String key() {
        return name().toLowerCase();
    }
}
