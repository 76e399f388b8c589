package com.archsketch.core.model;

/**
 * Name and type of a method parameter or receiver.
 *
 * @param name parameter name, empty if anonymous
 * @param type type text, empty if unknown
 */
public record ParameterDescriptor(String name, String type) {

    public ParameterDescriptor {
        if (name == null) {
            name = "";
        }
        if (type == null) {
            type = "";
        }
    }
}
