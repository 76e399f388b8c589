package com.archsketch.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Node of a generic, language-neutral syntax tree.
 *
 * <p>This is the only input shape the analysis engine understands. Trees are produced
 * outside the engine (typically a tree-sitter dump converted by
 * {@link com.archsketch.core.io.SyntaxTreeReader}) and are never mutated by it.
 *
 * <p>Parsers only put {@code text} on leaves. Missing fields are normalised rather than
 * rejected: a missing kind becomes the empty string, missing children an empty list and a
 * missing span {@link Span#EMPTY}.
 *
 * @param kind grammar node kind (e.g. {@code struct_type}, {@code identifier})
 * @param text source text for leaf nodes, {@code null} when absent
 * @param children ordered child nodes
 * @param span source range of the node
 */
public record SyntaxNode(
    String kind,
    String text,
    List<SyntaxNode> children,
    Span span
) {
    /**
     * Compact constructor with validation.
     */
    public SyntaxNode {
        if (kind == null) {
            kind = "";
        }
        children = children == null ? List.of() : List.copyOf(children);
        if (span == null) {
            span = Span.EMPTY;
        }
    }

    /**
     * Creates a leaf node carrying source text.
     *
     * @param kind node kind
     * @param text leaf text
     * @return leaf node with an empty span
     */
    public static SyntaxNode leaf(String kind, String text) {
        return new SyntaxNode(kind, text, List.of(), Span.EMPTY);
    }

    /**
     * Creates an interior node without text.
     *
     * @param kind node kind
     * @param children child nodes in source order
     * @return interior node with an empty span
     */
    public static SyntaxNode branch(String kind, SyntaxNode... children) {
        return new SyntaxNode(kind, null, Arrays.asList(children), Span.EMPTY);
    }

    /**
     * Returns true if the node carries source text.
     *
     * @return true when {@code text} is present
     */
    public boolean hasText() {
        return text != null;
    }

    /**
     * Returns the node text, or the empty string when absent.
     *
     * @return text or empty string
     */
    public String textOrEmpty() {
        return text == null ? "" : text;
    }

    /**
     * Returns the node text lower-cased with {@link Locale#ROOT}, empty when absent.
     *
     * @return case-folded text
     */
    public String foldedText() {
        return textOrEmpty().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns true if the node has no children.
     *
     * @return true for leaves
     */
    public boolean isLeaf() {
        return children.isEmpty();
    }
}
