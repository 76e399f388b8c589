package com.archsketch.core.model;

import java.util.List;

/**
 * Method declared by, or attached to, a component.
 *
 * @param name method name, empty if not found
 * @param parameters declared parameters in order
 * @param returnType return type text, empty if none
 * @param receiver receiver for methods bound to a type, {@code null} otherwise
 */
public record MethodDescriptor(
    String name,
    List<ParameterDescriptor> parameters,
    String returnType,
    ParameterDescriptor receiver
) {
    /**
     * Compact constructor with validation.
     */
    public MethodDescriptor {
        if (name == null) {
            name = "";
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        if (returnType == null) {
            returnType = "";
        }
    }
}
