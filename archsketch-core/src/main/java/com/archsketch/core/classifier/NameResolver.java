package com.archsketch.core.classifier;

import com.archsketch.core.model.SyntaxNode;
import com.archsketch.core.walker.TreeWalker;

import java.util.Set;

/**
 * Resolves a display name for a matched node.
 *
 * <p>Order: the node's own text; otherwise the text of the first descendant (pre-order)
 * whose kind is {@code identifier} or {@code field_identifier}; otherwise no name.
 */
public final class NameResolver {

    private static final Set<String> NAME_KINDS = Set.of("identifier", "field_identifier");

    private NameResolver() {
        // Utility class
    }

    /**
     * Resolves the display name of a node.
     *
     * @param node matched node
     * @return name, or {@code null} when none can be found
     */
    public static String resolve(SyntaxNode node) {
        if (node.hasText()) {
            return node.text();
        }
        return TreeWalker.findFirstDescendant(node, child -> NAME_KINDS.contains(child.kind()))
            .map(SyntaxNode::text)
            .orElse(null);
    }
}
