package com.archsketch.core.model;

import java.util.List;

/**
 * Immutable, sorted view of the component containment graph.
 *
 * <p>Edges are unique per {@code (from, to)} pair; relationship multiplicity is only
 * available from the raw relationship list.
 *
 * @param nodes component names, sorted
 * @param edges one relationship per distinct pair, sorted by source then target
 */
public record GraphSnapshot(List<String> nodes, List<Relationship> edges) {

    public GraphSnapshot {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public static GraphSnapshot empty() {
        return new GraphSnapshot(List.of(), List.of());
    }
}
