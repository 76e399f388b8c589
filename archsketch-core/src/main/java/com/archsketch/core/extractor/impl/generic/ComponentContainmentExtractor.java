package com.archsketch.core.extractor.impl.generic;

import com.archsketch.core.classifier.NameResolver;
import com.archsketch.core.classifier.NodeClassifier;
import com.archsketch.core.extractor.base.AbstractContainmentExtractor;
import com.archsketch.core.model.PatternCategory;
import com.archsketch.core.model.SyntaxNode;

import java.util.Objects;

/**
 * Containment relationships between nested generic components.
 *
 * <p>A component is any node the classifier places in {@link PatternCategory#COMPONENT};
 * its name comes from {@link NameResolver}.
 */
public class ComponentContainmentExtractor extends AbstractContainmentExtractor {

    private final NodeClassifier classifier;

    public ComponentContainmentExtractor(NodeClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    @Override
    public String getId() {
        return "component-containment";
    }

    @Override
    public String getDisplayName() {
        return "Component Containment";
    }

    @Override
    protected boolean isComponent(SyntaxNode node) {
        return classifier.classify(node, PatternCategory.COMPONENT);
    }

    @Override
    protected String componentName(SyntaxNode node) {
        return NameResolver.resolve(node);
    }
}
