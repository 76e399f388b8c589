package com.archsketch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lexically inferred orientation of a data-flow pattern.
 */
public enum FlowDirection {
    IN,
    OUT,
    BIDIRECTIONAL;

    @JsonValue
    public String key() {
        return name().toLowerCase();
    }
}
