package com.archsketch.core.extractor.impl.generic;

import com.archsketch.core.classifier.NodeClassifier;
import com.archsketch.core.extractor.base.AbstractPatternExtractor;
import com.archsketch.core.model.PatternCategory;

/**
 * Functions, methods, branches and loops, plus anything named like scheduling or clocking.
 */
public class ControlFlowExtractor extends AbstractPatternExtractor {

    public ControlFlowExtractor(NodeClassifier classifier) {
        super(classifier, PatternCategory.CONTROL_FLOW);
    }

    @Override
    public String getId() {
        return "control-flow";
    }

    @Override
    public String getDisplayName() {
        return "Control Flow";
    }
}
