package com.archsketch.core.aggregation.impl;

import com.archsketch.core.aggregation.AnalysisProfile;
import com.archsketch.core.aggregation.SourceFile;
import com.archsketch.core.classifier.NodeClassifier;
import com.archsketch.core.extractor.impl.generic.ComponentContainmentExtractor;
import com.archsketch.core.extractor.impl.generic.ComponentInventoryExtractor;
import com.archsketch.core.extractor.impl.generic.ControlFlowExtractor;
import com.archsketch.core.extractor.impl.generic.DataFlowExtractor;
import com.archsketch.core.extractor.impl.generic.StateExtractor;
import com.archsketch.core.graph.ArchitectureGraph;
import com.archsketch.core.graph.GraphBuilder;
import com.archsketch.core.model.ArchitectureMetrics;
import com.archsketch.core.model.ComponentRecord;
import com.archsketch.core.model.FileBuckets;
import com.archsketch.core.model.FileFailure;
import com.archsketch.core.model.ProjectAnalysis;
import com.archsketch.core.model.Relationship;
import com.archsketch.core.model.SyntaxNode;

import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Generic architecture analysis: containment, component inventory and flow patterns.
 *
 * <p>The component list is the sorted set of relationship endpoints. Components that are
 * never part of a relationship are left out unless {@code includeOrphanComponents} is set,
 * in which case every named component match is added to the list and to the graph.
 */
public class GenericArchitectureProfile implements AnalysisProfile<GenericPartial, ProjectAnalysis> {

    private final ComponentContainmentExtractor containment;
    private final ComponentInventoryExtractor inventory;
    private final ControlFlowExtractor controlFlow;
    private final DataFlowExtractor dataFlow;
    private final StateExtractor state;
    private final boolean includeOrphanComponents;

    public GenericArchitectureProfile() {
        this(new NodeClassifier(), false);
    }

    public GenericArchitectureProfile(NodeClassifier classifier, boolean includeOrphanComponents) {
        Objects.requireNonNull(classifier, "classifier must not be null");
        this.containment = new ComponentContainmentExtractor(classifier);
        this.inventory = new ComponentInventoryExtractor(classifier);
        this.controlFlow = new ControlFlowExtractor(classifier);
        this.dataFlow = new DataFlowExtractor(classifier);
        this.state = new StateExtractor(classifier);
        this.includeOrphanComponents = includeOrphanComponents;
    }

    @Override
    public String getId() {
        return "generic";
    }

    @Override
    public GenericPartial emptyPartial() {
        return GenericPartial.empty();
    }

    @Override
    public GenericPartial analyze(SourceFile file) {
        SyntaxNode tree = file.tree();
        return new GenericPartial(
            containment.extract(tree),
            inventory.extract(tree),
            controlFlow.extract(tree),
            dataFlow.extract(tree),
            state.extract(tree)
        );
    }

    @Override
    public GenericPartial merge(GenericPartial left, GenericPartial right) {
        return left.concat(right);
    }

    @Override
    public GenericPartial mergeAll(List<GenericPartial> partials) {
        return GenericPartial.concatAll(partials);
    }

    @Override
    public ProjectAnalysis finish(GenericPartial total, FileBuckets buckets, List<FileFailure> failures) {
        SortedSet<String> components = new TreeSet<>();
        for (Relationship relationship : total.relationships()) {
            components.add(relationship.from());
            if (relationship.to() != null) {
                components.add(relationship.to());
            }
        }

        ArchitectureGraph graph = GraphBuilder.build(total.relationships());
        if (includeOrphanComponents) {
            for (ComponentRecord record : total.componentRecords()) {
                if (record.name() != null) {
                    components.add(record.name());
                    graph.addNode(record.name());
                }
            }
        }

        ArchitectureMetrics metrics = new ArchitectureMetrics(
            components.size(),
            total.relationships().size(),
            total.controlFlowPatterns().size(),
            total.dataFlowPatterns().size(),
            total.statePatterns().size()
        );

        return new ProjectAnalysis(
            List.copyOf(components),
            total.relationships(),
            total.componentRecords(),
            total.controlFlowPatterns(),
            total.dataFlowPatterns(),
            total.statePatterns(),
            metrics,
            graph.snapshot(),
            buckets,
            failures
        );
    }
}
