package com.archsketch.core.extractor.impl.cgra;

import com.archsketch.core.model.FieldDescriptor;
import com.archsketch.core.model.InterfaceDescriptor;
import com.archsketch.core.model.MethodDescriptor;
import com.archsketch.core.model.ParameterDescriptor;
import com.archsketch.core.model.SyntaxNode;
import com.archsketch.core.walker.TreeWalker;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads the interface shape of a struct or interface type.
 *
 * <p>Only immediate children of the type node are inspected. Fields become
 * {@link FieldDescriptor}s (all of them listed as parameters, directional channels also as
 * inputs or outputs) and method declarations become {@link MethodDescriptor}s.
 *
 * <p>The node shapes follow the Go grammar:
 * <pre>
 * field_declaration   := field_identifier type [tag]
 * method_declaration  := [receiver | parameter_list] field_identifier parameter_list [parameter_list | type]
 * parameter_declaration := identifier type
 * </pre>
 */
public class InterfaceExtractor {

    private static final Set<String> DESCRIBED_KINDS = Set.of("struct_type", "interface_type");
    private static final Set<String> METHOD_KINDS = Set.of("method_declaration", "method_spec", "method_elem");
    private static final Set<String> TAG_KINDS = Set.of("tag", "raw_string_literal", "interpreted_string_literal");

    private static final String RECEIVE_ONLY_PREFIX = "<-chan";
    private static final String SEND_ONLY_MARKER = "chan<-";

    /**
     * Returns true if interfaces are read for nodes of this kind.
     *
     * @param node candidate node
     * @return true for struct and interface types
     */
    public boolean describes(SyntaxNode node) {
        return DESCRIBED_KINDS.contains(node.kind());
    }

    /**
     * Describes the interface of a node.
     *
     * @param node component node
     * @return descriptor, empty for kinds other than struct and interface types
     */
    public InterfaceDescriptor describe(SyntaxNode node) {
        if (!describes(node)) {
            return InterfaceDescriptor.empty();
        }

        List<FieldDescriptor> inputs = new ArrayList<>();
        List<FieldDescriptor> outputs = new ArrayList<>();
        List<FieldDescriptor> parameters = new ArrayList<>();
        List<MethodDescriptor> methods = new ArrayList<>();

        for (SyntaxNode child : node.children()) {
            if ("field_declaration".equals(child.kind())) {
                FieldDescriptor field = fieldOf(child);
                parameters.add(field);
                String compactType = field.type().replace(" ", "");
                if (compactType.startsWith(RECEIVE_ONLY_PREFIX)) {
                    inputs.add(field);
                } else if (compactType.contains(SEND_ONLY_MARKER)) {
                    outputs.add(field);
                }
            } else if (METHOD_KINDS.contains(child.kind())) {
                methods.add(methodOf(child));
            }
        }

        return new InterfaceDescriptor(inputs, outputs, parameters, methods);
    }

    FieldDescriptor fieldOf(SyntaxNode declaration) {
        String name = "";
        String type = "";
        List<String> tags = new ArrayList<>();

        for (SyntaxNode child : declaration.children()) {
            if ("field_identifier".equals(child.kind())) {
                if (name.isEmpty()) {
                    name = child.textOrEmpty();
                }
            } else if (TAG_KINDS.contains(child.kind())) {
                tags.add(textOf(child));
            } else if (isType(child) && type.isEmpty()) {
                type = textOf(child);
            }
        }

        return new FieldDescriptor(name, type, tags);
    }

    MethodDescriptor methodOf(SyntaxNode declaration) {
        String name = "";
        boolean nameSeen = false;
        boolean parametersSeen = false;
        ParameterDescriptor receiver = null;
        List<ParameterDescriptor> parameters = List.of();
        String returnType = "";

        for (SyntaxNode child : declaration.children()) {
            String kind = child.kind();
            if (!nameSeen && ("field_identifier".equals(kind) || "identifier".equals(kind))) {
                name = child.textOrEmpty();
                nameSeen = true;
            } else if ("receiver".equals(kind)) {
                receiver = receiverOf(child);
            } else if ("parameter_list".equals(kind)) {
                if (!nameSeen) {
                    receiver = receiverOf(child);
                } else if (!parametersSeen) {
                    parameters = parametersOf(child);
                    parametersSeen = true;
                } else {
                    returnType = textOf(child);
                }
            } else if (parametersSeen && isType(child)) {
                returnType = textOf(child);
            }
        }

        return new MethodDescriptor(name, parameters, returnType, receiver);
    }

    private List<ParameterDescriptor> parametersOf(SyntaxNode parameterList) {
        List<ParameterDescriptor> parameters = new ArrayList<>();
        for (SyntaxNode child : parameterList.children()) {
            if ("parameter_declaration".equals(child.kind())) {
                parameters.add(parameterOf(child));
            }
        }
        return parameters;
    }

    private ParameterDescriptor receiverOf(SyntaxNode receiver) {
        return TreeWalker.findFirstDescendant(receiver, n -> "parameter_declaration".equals(n.kind()))
            .map(this::parameterOf)
            .orElseGet(() -> parameterOf(receiver));
    }

    private ParameterDescriptor parameterOf(SyntaxNode declaration) {
        String name = "";
        String type = "";
        for (SyntaxNode child : declaration.children()) {
            if ("identifier".equals(child.kind()) && name.isEmpty()) {
                name = child.textOrEmpty();
            } else if (isType(child) && type.isEmpty()) {
                type = textOf(child);
            }
        }
        return new ParameterDescriptor(name, type);
    }

    private static boolean isType(SyntaxNode node) {
        String kind = node.kind();
        return "type_identifier".equals(kind) || kind.endsWith("_type");
    }

    private static String textOf(SyntaxNode node) {
        return node.hasText() ? node.text() : TreeWalker.joinLeafText(node);
    }
}
