package com.archsketch.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Interface shape of a CGRA component: its ports, fields and methods.
 *
 * <p>{@code parameters} lists every field of the component; {@code inputs} and
 * {@code outputs} additionally list the fields that are receive-only or send-only channels.
 *
 * @param inputs receive-only channel fields
 * @param outputs send-only channel fields
 * @param parameters all declared fields
 * @param methods declared methods
 */
public record InterfaceDescriptor(
    List<FieldDescriptor> inputs,
    List<FieldDescriptor> outputs,
    List<FieldDescriptor> parameters,
    List<MethodDescriptor> methods
) {
    private static final InterfaceDescriptor EMPTY =
        new InterfaceDescriptor(List.of(), List.of(), List.of(), List.of());

    /**
     * Compact constructor with validation.
     */
    public InterfaceDescriptor {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        methods = methods == null ? List.of() : List.copyOf(methods);
    }

    /**
     * Returns the descriptor used for components that are not struct or interface types.
     *
     * @return descriptor with all lists empty
     */
    public static InterfaceDescriptor empty() {
        return EMPTY;
    }

    /**
     * Returns true if nothing was extracted.
     *
     * @return true when all lists are empty
     */
    @JsonIgnore
    public boolean isEmpty() {
        return inputs.isEmpty() && outputs.isEmpty() && parameters.isEmpty() && methods.isEmpty();
    }
}
