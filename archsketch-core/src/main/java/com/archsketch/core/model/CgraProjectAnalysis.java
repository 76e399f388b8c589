package com.archsketch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Project-wide result of the CGRA analysis.
 *
 * <p>{@code components} always holds one entry per {@link CgraComponentCategory}, keyed by
 * {@link CgraComponentCategory#key()} in priority order. {@code dataflow} always holds one
 * entry per {@link ChannelEventKind}, keyed by {@link ChannelEventKind#key()}.
 *
 * @param components components grouped by category key
 * @param relationships containment relationships between CGRA components
 * @param dataflow channel events grouped by event kind key
 * @param fileBuckets analysed files grouped by role
 * @param diagnostics files that were skipped
 */
public record CgraProjectAnalysis(
    Map<String, List<CgraComponent>> components,
    List<Relationship> relationships,
    Map<String, List<ChannelEvent>> dataflow,
    FileBuckets fileBuckets,
    List<FileFailure> diagnostics
) {
    /**
     * Compact constructor with validation.
     */
    public CgraProjectAnalysis {
        Map<String, List<CgraComponent>> byCategory = new LinkedHashMap<>();
        for (CgraComponentCategory category : CgraComponentCategory.values()) {
            List<CgraComponent> found = components == null ? null : components.get(category.key());
            byCategory.put(category.key(), found == null ? List.of() : List.copyOf(found));
        }
        components = Collections.unmodifiableMap(byCategory);

        relationships = relationships == null ? List.of() : List.copyOf(relationships);

        Map<String, List<ChannelEvent>> byKind = new LinkedHashMap<>();
        for (ChannelEventKind kind : ChannelEventKind.values()) {
            List<ChannelEvent> found = dataflow == null ? null : dataflow.get(kind.key());
            byKind.put(kind.key(), found == null ? List.of() : List.copyOf(found));
        }
        dataflow = Collections.unmodifiableMap(byKind);

        if (fileBuckets == null) {
            fileBuckets = FileBuckets.empty();
        }
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Returns the components of one category.
     *
     * @param category CGRA category
     * @return components in discovery order
     */
    public List<CgraComponent> componentsOf(CgraComponentCategory category) {
        return components.get(category.key());
    }

    /**
     * Returns the channel events of one kind.
     *
     * @param kind send or receive
     * @return events in discovery order
     */
    public List<ChannelEvent> eventsOf(ChannelEventKind kind) {
        return dataflow.get(kind.key());
    }

    /**
     * Returns the number of components across all categories.
     *
     * @return component count
     */
    public int totalComponents() {
        return components.values().stream().mapToInt(List::size).sum();
    }

    /**
     * Returns the number of channel events of both kinds.
     *
     * @return event count
     */
    public int totalChannelEvents() {
        return dataflow.values().stream().mapToInt(List::size).sum();
    }
}
