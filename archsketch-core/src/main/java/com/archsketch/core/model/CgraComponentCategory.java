package com.archsketch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Hardware-design taxonomy used to type CGRA components.
 *
 * <p>Declaration order is the classification priority: when a node matches keywords of
 * several categories, the one declared first wins.
 */
public enum CgraComponentCategory {
    PROCESSING_ELEMENT("processing_elements"),
    INTERCONNECT("interconnects"),
    MEMORY("memories"),
    CONTROL("controls"),
    CONFIGURATION("configurations");

    private final String key;

    CgraComponentCategory(String key) {
        this.key = key;
    }

    /**
     * Returns the plural key used as the document section name.
     *
     * @return key such as {@code processing_elements}
     */
    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Resolves a category from its key, its singular form or its enum name.
     *
     * @param value e.g. {@code memories}, {@code memory} or {@code MEMORY}
     * @return matching category
     * @throws IllegalArgumentException if no category matches
     */
    public static CgraComponentCategory fromKey(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase().replace('-', '_');
        for (CgraComponentCategory category : values()) {
            if (category.key.equals(normalized) || category.name().toLowerCase().equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown CGRA component category: " + value);
    }
}
