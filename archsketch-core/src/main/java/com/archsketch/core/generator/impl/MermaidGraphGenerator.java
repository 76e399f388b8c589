package com.archsketch.core.generator.impl;

import com.archsketch.core.generator.GeneratedReport;
import com.archsketch.core.generator.GeneratorConfig;
import com.archsketch.core.generator.ReportGenerator;
import com.archsketch.core.graph.ArchitectureGraph;
import com.archsketch.core.graph.GraphBuilder;
import com.archsketch.core.model.AnalysisDocument;
import com.archsketch.core.model.ArchitectureDocument;
import com.archsketch.core.model.GraphSnapshot;
import com.archsketch.core.model.Relationship;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Renders the containment graph as a Mermaid flowchart embedded in Markdown.
 *
 * <p>Generic documents use their graph snapshot; CGRA documents have none, so the graph is
 * built from their relationships. Node IDs are sanitised names, made unique with a suffix
 * when two names sanitise to the same ID.
 */
public class MermaidGraphGenerator implements ReportGenerator {

    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";
    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";
    private static final String NO_COMPONENTS_NODE = "  empty[No components found]\n";

    @Override
    public String getId() {
        return "mermaid";
    }

    @Override
    public String getDisplayName() {
        return "Mermaid Containment Graph";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public GeneratedReport generate(AnalysisDocument document, GeneratorConfig config) {
        GraphSnapshot graph = document instanceof ArchitectureDocument architecture
            ? architecture.analysis().graph()
            : build(document);
        String direction = config.getSettingOrDefault("mermaid.direction", "TB");

        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(document.metadata().description()).append(": Containment").append("\n\n");
        sb.append(CODE_BLOCK_START);
        sb.append("graph ").append(direction).append("\n");

        if (graph.nodes().isEmpty()) {
            sb.append(NO_COMPONENTS_NODE);
        }

        Map<String, String> ids = new HashMap<>();
        Set<String> used = new HashSet<>();
        for (String node : graph.nodes()) {
            String id = uniqueId(node, used);
            ids.put(node, id);
            sb.append("  ").append(id).append("[\"").append(escapeLabel(node)).append("\"]\n");
        }
        for (Relationship edge : graph.edges()) {
            sb.append("  ").append(ids.get(edge.from()))
                .append(" -->|").append(edge.kind().key()).append("| ")
                .append(ids.get(edge.to())).append("\n");
        }
        sb.append(CODE_BLOCK_END);

        return new GeneratedReport(config.baseName() + "_graph", sb.toString(), getFileExtension(), "text/markdown");
    }

    private static GraphSnapshot build(AnalysisDocument document) {
        ArchitectureGraph graph = GraphBuilder.build(document.relationships());
        return graph.snapshot();
    }

    private static String uniqueId(String name, Set<String> used) {
        String base = name.replaceAll(ID_SANITIZATION_PATTERN, "_");
        if (base.isEmpty() || Character.isDigit(base.charAt(0))) {
            base = "n_" + base;
        }
        String id = base;
        int suffix = 2;
        while (!used.add(id)) {
            id = base + "_" + suffix++;
        }
        return id;
    }

    private static String escapeLabel(String label) {
        return label.replace("\"", "#quot;");
    }
}
