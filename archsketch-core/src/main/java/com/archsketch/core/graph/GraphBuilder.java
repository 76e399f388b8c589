package com.archsketch.core.graph;

import com.archsketch.core.model.Relationship;

import java.util.Collection;

/**
 * Builds an {@link ArchitectureGraph} from raw relationships.
 *
 * <p>Relationships with an absent target contribute only their source node. Repeated
 * relationships collapse into one edge; the raw list keeps the multiplicity.
 */
public final class GraphBuilder {

    private GraphBuilder() {
        // Utility class
    }

    public static ArchitectureGraph build(Collection<Relationship> relationships) {
        ArchitectureGraph graph = new ArchitectureGraph();
        for (Relationship relationship : relationships) {
            if (relationship.to() == null) {
                graph.addNode(relationship.from());
            } else {
                graph.putEdge(relationship);
            }
        }
        return graph;
    }
}
