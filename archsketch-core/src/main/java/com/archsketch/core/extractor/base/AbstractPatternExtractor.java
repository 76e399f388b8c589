package com.archsketch.core.extractor.base;

import com.archsketch.core.classifier.NameResolver;
import com.archsketch.core.classifier.NodeClassifier;
import com.archsketch.core.model.FlowDirection;
import com.archsketch.core.model.FlowPattern;
import com.archsketch.core.model.PatternCategory;
import com.archsketch.core.model.SyntaxNode;
import com.archsketch.core.walker.TreeWalker;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Records a {@link FlowPattern} for every node matching one generic category.
 *
 * <p>Nesting is ignored: a matching node and a matching ancestor both produce entries.
 */
public abstract class AbstractPatternExtractor extends AbstractExtractor<FlowPattern> {

    private final NodeClassifier classifier;
    private final PatternCategory category;

    protected AbstractPatternExtractor(NodeClassifier classifier, PatternCategory category) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.category = Objects.requireNonNull(category, "category must not be null");
    }

    /**
     * Returns the direction to record for a matched node.
     *
     * <p>Defaults to none; the data-flow extractor overrides it.
     *
     * @param node matched node
     * @return direction or {@code null}
     */
    protected FlowDirection directionOf(SyntaxNode node) {
        return null;
    }

    @Override
    public List<FlowPattern> extract(SyntaxNode root) {
        List<FlowPattern> patterns = new ArrayList<>();
        TreeWalker.walk(root, node -> {
            if (classifier.classify(node, category)) {
                patterns.add(new FlowPattern(
                    category,
                    NameResolver.resolve(node),
                    node.kind(),
                    node.span(),
                    directionOf(node)
                ));
            }
        });
        return finish(patterns);
    }

    /**
     * Returns the category this extractor records.
     *
     * @return pattern category
     */
    public PatternCategory category() {
        return category;
    }
}
