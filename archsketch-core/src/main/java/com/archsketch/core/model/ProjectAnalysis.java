package com.archsketch.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Project-wide result of the generic architecture analysis.
 *
 * <p>Produced once per batch by the aggregation engine after all files were folded.
 * List order follows the canonical file order (component, then relative path) and, within
 * a file, pre-order traversal order; {@code components} is sorted.
 *
 * @param components component names seen as relationship endpoints (plus orphans when enabled)
 * @param relationships raw containment relationships, duplicates included
 * @param componentRecords every node matched as a component, orphans included
 * @param controlFlowPatterns control-flow pattern occurrences
 * @param dataFlowPatterns data-flow pattern occurrences
 * @param statePatterns state pattern occurrences
 * @param metrics counts of the collections above
 * @param graph containment graph derived from {@code relationships}
 * @param fileBuckets analysed files grouped by role
 * @param diagnostics files that were skipped
 */
public record ProjectAnalysis(
    List<String> components,
    List<Relationship> relationships,
    List<ComponentRecord> componentRecords,
    List<FlowPattern> controlFlowPatterns,
    List<FlowPattern> dataFlowPatterns,
    List<FlowPattern> statePatterns,
    ArchitectureMetrics metrics,
    GraphSnapshot graph,
    FileBuckets fileBuckets,
    List<FileFailure> diagnostics
) {
    /**
     * Compact constructor with validation.
     */
    public ProjectAnalysis {
        components = components == null ? List.of() : List.copyOf(components);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        componentRecords = componentRecords == null ? List.of() : List.copyOf(componentRecords);
        controlFlowPatterns = controlFlowPatterns == null ? List.of() : List.copyOf(controlFlowPatterns);
        dataFlowPatterns = dataFlowPatterns == null ? List.of() : List.copyOf(dataFlowPatterns);
        statePatterns = statePatterns == null ? List.of() : List.copyOf(statePatterns);
        Objects.requireNonNull(metrics, "metrics must not be null");
        if (graph == null) {
            graph = GraphSnapshot.empty();
        }
        if (fileBuckets == null) {
            fileBuckets = FileBuckets.empty();
        }
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }
}
