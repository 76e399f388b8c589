package com.archsketch.core.walker;

import com.archsketch.core.model.SyntaxNode;

/**
 * Callback invoked by {@link TreeWalker} for every node in pre-order.
 *
 * @param <C> type of the context threaded from parents to children
 */
@FunctionalInterface
public interface NodeVisitor<C> {

    /**
     * Visits a node.
     *
     * @param node the node being visited
     * @param context context inherited from the parent, may be {@code null}
     * @return context handed to this node's children
     */
    C visit(SyntaxNode node, C context);
}
