package com.archsketch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Architectural roles recognised by the generic classifier.
 *
 * <p>Categories are not exclusive: every extractor walks the whole tree on its own, so one
 * node can be recorded under several of them.
 */
public enum PatternCategory {
    /** Structural building blocks (structs, classes, modules). */
    COMPONENT("component"),

    /** Scheduling and branching hot spots. */
    CONTROL_FLOW("control_flow"),

    /** Conduits that move data (fields, channels, buffers). */
    DATA_FLOW("data_flow"),

    /** Configuration and mutable state holders. */
    STATE("state");

    private final String key;

    PatternCategory(String key) {
        this.key = key;
    }

    /**
     * Returns the stable key used in documents and configuration.
     *
     * @return snake_case key
     */
    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Resolves a category from its key or enum name, ignoring case and dashes.
     *
     * @param value key such as {@code control_flow} or {@code control-flow}
     * @return matching category
     * @throws IllegalArgumentException if no category matches
     */
    public static PatternCategory fromKey(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase().replace('-', '_');
        for (PatternCategory category : values()) {
            if (category.key.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown pattern category: " + value);
    }
}
