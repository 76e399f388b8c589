package com.archsketch.core.extractor.impl.generic;

import com.archsketch.core.classifier.NodeClassifier;
import com.archsketch.core.extractor.base.AbstractPatternExtractor;
import com.archsketch.core.model.PatternCategory;

/**
 * Configuration and state holders: constants, registers, mode and status fields.
 */
public class StateExtractor extends AbstractPatternExtractor {

    public StateExtractor(NodeClassifier classifier) {
        super(classifier, PatternCategory.STATE);
    }

    @Override
    public String getId() {
        return "state";
    }

    @Override
    public String getDisplayName() {
        return "State";
    }
}
