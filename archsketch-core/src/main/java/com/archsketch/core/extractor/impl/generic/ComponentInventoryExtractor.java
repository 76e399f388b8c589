package com.archsketch.core.extractor.impl.generic;

import com.archsketch.core.classifier.NameResolver;
import com.archsketch.core.classifier.NodeClassifier;
import com.archsketch.core.extractor.base.AbstractExtractor;
import com.archsketch.core.model.ComponentRecord;
import com.archsketch.core.model.PatternCategory;
import com.archsketch.core.model.SyntaxNode;
import com.archsketch.core.walker.TreeWalker;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Records every component match, top-level components included.
 *
 * <p>Unlike {@link ComponentContainmentExtractor} this pass does not depend on nesting,
 * so components without an enclosing component are still listed.
 */
public class ComponentInventoryExtractor extends AbstractExtractor<ComponentRecord> {

    private final NodeClassifier classifier;

    public ComponentInventoryExtractor(NodeClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    @Override
    public String getId() {
        return "component-inventory";
    }

    @Override
    public String getDisplayName() {
        return "Component Inventory";
    }

    @Override
    public List<ComponentRecord> extract(SyntaxNode root) {
        List<ComponentRecord> records = new ArrayList<>();
        TreeWalker.walk(root, node -> {
            if (classifier.classify(node, PatternCategory.COMPONENT)) {
                records.add(new ComponentRecord(NameResolver.resolve(node), node.kind(), node.span()));
            }
        });
        return finish(records);
    }
}
