package com.archsketch.core.aggregation.impl;

import com.archsketch.core.model.ComponentRecord;
import com.archsketch.core.model.FlowPattern;
import com.archsketch.core.model.Relationship;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-file result of the generic architecture profile.
 *
 * @param relationships containment relationships
 * @param componentRecords every component match
 * @param controlFlowPatterns control-flow matches
 * @param dataFlowPatterns data-flow matches
 * @param statePatterns state matches
 */
public record GenericPartial(
    List<Relationship> relationships,
    List<ComponentRecord> componentRecords,
    List<FlowPattern> controlFlowPatterns,
    List<FlowPattern> dataFlowPatterns,
    List<FlowPattern> statePatterns
) {
    private static final GenericPartial EMPTY =
        new GenericPartial(List.of(), List.of(), List.of(), List.of(), List.of());

    /**
     * Compact constructor with validation.
     */
    public GenericPartial {
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        componentRecords = componentRecords == null ? List.of() : List.copyOf(componentRecords);
        controlFlowPatterns = controlFlowPatterns == null ? List.of() : List.copyOf(controlFlowPatterns);
        dataFlowPatterns = dataFlowPatterns == null ? List.of() : List.copyOf(dataFlowPatterns);
        statePatterns = statePatterns == null ? List.of() : List.copyOf(statePatterns);
    }

    public static GenericPartial empty() {
        return EMPTY;
    }

    /**
     * Appends {@code other} after this partial.
     *
     * @param other later partial
     * @return concatenation
     */
    public GenericPartial concat(GenericPartial other) {
        return new GenericPartial(
            join(relationships, other.relationships),
            join(componentRecords, other.componentRecords),
            join(controlFlowPatterns, other.controlFlowPatterns),
            join(dataFlowPatterns, other.dataFlowPatterns),
            join(statePatterns, other.statePatterns)
        );
    }

    /**
     * Concatenates partials in list order, copying each record once.
     *
     * @param partials partials in fold order
     * @return concatenation of all partials
     */
    public static GenericPartial concatAll(List<GenericPartial> partials) {
        List<Relationship> relationships = new ArrayList<>();
        List<ComponentRecord> componentRecords = new ArrayList<>();
        List<FlowPattern> controlFlowPatterns = new ArrayList<>();
        List<FlowPattern> dataFlowPatterns = new ArrayList<>();
        List<FlowPattern> statePatterns = new ArrayList<>();
        for (GenericPartial partial : partials) {
            relationships.addAll(partial.relationships);
            componentRecords.addAll(partial.componentRecords);
            controlFlowPatterns.addAll(partial.controlFlowPatterns);
            dataFlowPatterns.addAll(partial.dataFlowPatterns);
            statePatterns.addAll(partial.statePatterns);
        }
        return new GenericPartial(relationships, componentRecords, controlFlowPatterns, dataFlowPatterns, statePatterns);
    }

    static <T> List<T> join(List<T> first, List<T> second) {
        if (second.isEmpty()) {
            return first;
        }
        if (first.isEmpty()) {
            return second;
        }
        List<T> joined = new ArrayList<>(first.size() + second.size());
        joined.addAll(first);
        joined.addAll(second);
        return joined;
    }
}
