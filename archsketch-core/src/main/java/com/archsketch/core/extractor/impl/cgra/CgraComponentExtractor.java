package com.archsketch.core.extractor.impl.cgra;

import com.archsketch.core.classifier.CgraComponentClassifier;
import com.archsketch.core.extractor.base.AbstractExtractor;
import com.archsketch.core.model.CgraComponent;
import com.archsketch.core.model.CgraComponentCategory;
import com.archsketch.core.model.SyntaxNode;
import com.archsketch.core.walker.TreeWalker;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies nodes into the CGRA hardware taxonomy.
 *
 * <p>Every node with text is tested; the first category in priority order wins. Struct and
 * interface types additionally get their interface described by {@link InterfaceExtractor}.
 */
public class CgraComponentExtractor extends AbstractExtractor<CgraComponent> {

    private final CgraComponentClassifier classifier;
    private final InterfaceExtractor interfaces;

    public CgraComponentExtractor(CgraComponentClassifier classifier) {
        this(classifier, new InterfaceExtractor());
    }

    public CgraComponentExtractor(CgraComponentClassifier classifier, InterfaceExtractor interfaces) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.interfaces = Objects.requireNonNull(interfaces, "interfaces must not be null");
    }

    @Override
    public String getId() {
        return "cgra-components";
    }

    @Override
    public String getDisplayName() {
        return "CGRA Components";
    }

    @Override
    public List<CgraComponent> extract(SyntaxNode root) {
        List<CgraComponent> components = new ArrayList<>();
        TreeWalker.walk(root, node -> {
            Optional<CgraComponentCategory> category = classifier.classify(node);
            category.ifPresent(c -> components.add(new CgraComponent(
                c,
                node.text(),
                node.kind(),
                node.span(),
                interfaces.describe(node)
            )));
        });
        return finish(components);
    }
}
