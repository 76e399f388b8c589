package com.archsketch.core.model;

import java.util.List;

/**
 * Field of a struct or interface component.
 *
 * @param name field name, empty if anonymous (embedded field)
 * @param type type text, empty if unknown
 * @param tags struct tags attached to the field
 */
public record FieldDescriptor(
    String name,
    String type,
    List<String> tags
) {
    /**
     * Compact constructor with validation.
     */
    public FieldDescriptor {
        if (name == null) {
            name = "";
        }
        if (type == null) {
            type = "";
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
