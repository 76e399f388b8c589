package com.archsketch.core.extractor.impl.cgra;

import com.archsketch.core.classifier.CgraComponentClassifier;
import com.archsketch.core.extractor.base.AbstractContainmentExtractor;
import com.archsketch.core.model.CgraComponentCategory;
import com.archsketch.core.model.SyntaxNode;

import java.util.Objects;

/**
 * Containment between nested CGRA components, keyed on their category.
 *
 * <p>Both endpoints are category keys, e.g. {@code interconnects} contains {@code memories}.
 */
public class CgraContainmentExtractor extends AbstractContainmentExtractor {

    private final CgraComponentClassifier classifier;

    public CgraContainmentExtractor(CgraComponentClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    @Override
    public String getId() {
        return "cgra-containment";
    }

    @Override
    public String getDisplayName() {
        return "CGRA Containment";
    }

    @Override
    protected boolean isComponent(SyntaxNode node) {
        return classifier.classify(node).isPresent();
    }

    @Override
    protected String componentName(SyntaxNode node) {
        return classifier.classify(node).map(CgraComponentCategory::key).orElse(null);
    }
}
