package com.archsketch.core.graph;

import com.archsketch.core.model.GraphSnapshot;
import com.archsketch.core.model.Relationship;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed graph over component names.
 *
 * <p>Nodes are keyed by name; edges are keyed by {@code (from, to)} and a later edge with
 * the same endpoints replaces the earlier one. Not thread-safe: the graph is built by a
 * single writer after aggregation.
 */
public class ArchitectureGraph {

    private final Set<String> nodes = new TreeSet<>();
    private final Map<String, Map<String, Relationship>> adjacency = new TreeMap<>();

    /**
     * Adds a node; adding an existing name is a no-op.
     *
     * @param name node name
     */
    public void addNode(String name) {
        nodes.add(Objects.requireNonNull(name, "name must not be null"));
    }

    /**
     * Adds or replaces the edge between two nodes, adding both nodes.
     *
     * @param edge relationship with both endpoints present
     */
    public void putEdge(Relationship edge) {
        Objects.requireNonNull(edge, "edge must not be null");
        Objects.requireNonNull(edge.to(), "edge target must not be null");
        addNode(edge.from());
        addNode(edge.to());
        adjacency.computeIfAbsent(edge.from(), k -> new TreeMap<>()).put(edge.to(), edge);
    }

    public boolean containsNode(String name) {
        return nodes.contains(name);
    }

    /**
     * Returns the names directly reachable from a node, sorted.
     *
     * @param name source node
     * @return successor names, empty for unknown nodes
     */
    public List<String> successors(String name) {
        Map<String, Relationship> out = adjacency.get(name);
        return out == null ? List.of() : List.copyOf(out.keySet());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return adjacency.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Returns an immutable view sorted by node name and by {@code (from, to)}.
     *
     * @return graph snapshot
     */
    public GraphSnapshot snapshot() {
        List<Relationship> edges = new ArrayList<>();
        adjacency.values().forEach(out -> edges.addAll(out.values()));
        edges.sort(Comparator.comparing(Relationship::from).thenComparing(Relationship::to));
        return new GraphSnapshot(List.copyOf(nodes), edges);
    }
}
