package com.archsketch.core.extractor.base;

import com.archsketch.core.model.Relationship;
import com.archsketch.core.model.SyntaxNode;
import com.archsketch.core.walker.TreeWalker;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives containment relationships between nested components.
 *
 * <p>The walk carries the name of the nearest enclosing component as context. At a
 * component node the extractor resolves its name; if an enclosing component exists it
 * emits {@code enclosing CONTAINS name}. A resolved name becomes the context of the
 * subtree; an unresolved one leaves the inherited context in place.
 *
 * <p>A component without an enclosing component emits nothing. Top-level components are
 * therefore only visible through relationships in which they are the source.
 *
 * <p>Subclasses decide what a component is and how it is named.
 */
public abstract class AbstractContainmentExtractor extends AbstractExtractor<Relationship> {

    /**
     * Returns true if the node is a component for this extractor.
     *
     * @param node node to test
     * @return true for component nodes
     */
    protected abstract boolean isComponent(SyntaxNode node);

    /**
     * Resolves the name of a component node.
     *
     * @param node component node
     * @return name, or {@code null} if unresolved
     */
    protected abstract String componentName(SyntaxNode node);

    @Override
    public List<Relationship> extract(SyntaxNode root) {
        List<Relationship> relationships = new ArrayList<>();
        TreeWalker.<String>walk(root, null, (node, enclosing) -> {
            if (!isComponent(node)) {
                return enclosing;
            }
            String name = componentName(node);
            if (enclosing != null) {
                relationships.add(Relationship.contains(enclosing, name));
            }
            return name != null ? name : enclosing;
        });
        return finish(relationships);
    }
}
