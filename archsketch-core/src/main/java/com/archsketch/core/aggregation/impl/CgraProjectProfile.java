package com.archsketch.core.aggregation.impl;

import com.archsketch.core.aggregation.AnalysisProfile;
import com.archsketch.core.aggregation.SourceFile;
import com.archsketch.core.classifier.CgraComponentClassifier;
import com.archsketch.core.extractor.impl.cgra.CgraComponentExtractor;
import com.archsketch.core.extractor.impl.cgra.CgraContainmentExtractor;
import com.archsketch.core.extractor.impl.cgra.ChannelEventExtractor;
import com.archsketch.core.model.CgraComponent;
import com.archsketch.core.model.CgraProjectAnalysis;
import com.archsketch.core.model.ChannelEvent;
import com.archsketch.core.model.FileBuckets;
import com.archsketch.core.model.FileFailure;
import com.archsketch.core.model.SyntaxNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CGRA project analysis: hardware components by category, their containment, and
 * channel send/receive events.
 */
public class CgraProjectProfile implements AnalysisProfile<CgraPartial, CgraProjectAnalysis> {

    private final CgraComponentExtractor components;
    private final CgraContainmentExtractor containment;
    private final ChannelEventExtractor channels;

    public CgraProjectProfile() {
        this(new CgraComponentClassifier());
    }

    public CgraProjectProfile(CgraComponentClassifier classifier) {
        Objects.requireNonNull(classifier, "classifier must not be null");
        this.components = new CgraComponentExtractor(classifier);
        this.containment = new CgraContainmentExtractor(classifier);
        this.channels = new ChannelEventExtractor();
    }

    @Override
    public String getId() {
        return "cgra";
    }

    @Override
    public CgraPartial emptyPartial() {
        return CgraPartial.empty();
    }

    @Override
    public CgraPartial analyze(SourceFile file) {
        SyntaxNode tree = file.tree();
        return new CgraPartial(
            components.extract(tree),
            containment.extract(tree),
            channels.extract(tree)
        );
    }

    @Override
    public CgraPartial merge(CgraPartial left, CgraPartial right) {
        return left.concat(right);
    }

    @Override
    public CgraPartial mergeAll(List<CgraPartial> partials) {
        return CgraPartial.concatAll(partials);
    }

    @Override
    public CgraProjectAnalysis finish(CgraPartial total, FileBuckets buckets, List<FileFailure> failures) {
        Map<String, List<CgraComponent>> byCategory = new LinkedHashMap<>();
        for (CgraComponent component : total.components()) {
            byCategory.computeIfAbsent(component.category().key(), k -> new ArrayList<>()).add(component);
        }

        Map<String, List<ChannelEvent>> byKind = new LinkedHashMap<>();
        for (ChannelEvent event : total.channelEvents()) {
            byKind.computeIfAbsent(event.kind().key(), k -> new ArrayList<>()).add(event);
        }

        return new CgraProjectAnalysis(byCategory, total.relationships(), byKind, buckets, failures);
    }
}
