package com.archsketch.core.extractor.impl.generic;

import com.archsketch.core.classifier.DirectionResolver;
import com.archsketch.core.classifier.NodeClassifier;
import com.archsketch.core.extractor.base.AbstractPatternExtractor;
import com.archsketch.core.model.FlowDirection;
import com.archsketch.core.model.PatternCategory;
import com.archsketch.core.model.SyntaxNode;

/**
 * Data conduits: fields, variables, channels and buffers.
 *
 * <p>Each match carries a direction derived from the node text by {@link DirectionResolver}.
 */
public class DataFlowExtractor extends AbstractPatternExtractor {

    public DataFlowExtractor(NodeClassifier classifier) {
        super(classifier, PatternCategory.DATA_FLOW);
    }

    @Override
    public String getId() {
        return "data-flow";
    }

    @Override
    public String getDisplayName() {
        return "Data Flow";
    }

    @Override
    protected FlowDirection directionOf(SyntaxNode node) {
        return DirectionResolver.resolve(node);
    }
}
