package com.archsketch.core;

import com.archsketch.core.model.Span;
import com.archsketch.core.model.SyntaxNode;

import java.util.List;

/**
 * Builders for hand-made syntax trees used across tests.
 */
public final class TreeFixtures {

    private TreeFixtures() {
        // Utility class
    }

    public static SyntaxNode leaf(String kind, String text) {
        return SyntaxNode.leaf(kind, text);
    }

    public static SyntaxNode node(String kind, SyntaxNode... children) {
        return SyntaxNode.branch(kind, children);
    }

    /**
     * Interior node carrying text, as in hand-written scenario trees.
     */
    public static SyntaxNode named(String kind, String text, SyntaxNode... children) {
        return new SyntaxNode(kind, text, List.of(children), Span.EMPTY);
    }

    public static SyntaxNode at(SyntaxNode node, int row) {
        return new SyntaxNode(node.kind(), node.text(), node.children(), Span.of(row, 0, row, 10));
    }

    /**
     * Chain of {@code depth} nested {@code block} nodes ending in a leaf.
     */
    public static SyntaxNode deepChain(int depth, SyntaxNode bottom) {
        SyntaxNode current = bottom;
        for (int i = 0; i < depth; i++) {
            current = new SyntaxNode("block", null, List.of(current), Span.EMPTY);
        }
        return current;
    }

    /**
     * {@code ClusterModule} containing {@code ProcessingElementPE0}.
     */
    public static SyntaxNode clusterScenario() {
        return named("struct_type", "ClusterModule",
            named("struct_type", "ProcessingElementPE0"));
    }
}
