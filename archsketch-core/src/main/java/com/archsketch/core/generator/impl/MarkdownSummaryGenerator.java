package com.archsketch.core.generator.impl;

import com.archsketch.core.generator.GeneratedReport;
import com.archsketch.core.generator.GeneratorConfig;
import com.archsketch.core.generator.ReportGenerator;
import com.archsketch.core.model.AnalysisDocument;
import com.archsketch.core.model.ArchitectureDocument;
import com.archsketch.core.model.CgraComponent;
import com.archsketch.core.model.CgraComponentCategory;
import com.archsketch.core.model.CgraProjectAnalysis;
import com.archsketch.core.model.CgraProjectDocument;
import com.archsketch.core.model.ChannelEventKind;
import com.archsketch.core.model.FileBucket;
import com.archsketch.core.model.FileBuckets;
import com.archsketch.core.model.FileFailure;
import com.archsketch.core.model.FlowPattern;
import com.archsketch.core.model.ProjectAnalysis;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Human-readable summary of an analysis as Markdown.
 *
 * <p>Generic documents list totals, the first components by name, control-flow patterns
 * by node kind and data-flow patterns by direction. CGRA documents list components per
 * category with their interface sizes and channel event counts. Both end with file
 * buckets and diagnostics.
 */
public class MarkdownSummaryGenerator implements ReportGenerator {

    private static final String NEWLINE = "\n";

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getDisplayName() {
        return "Markdown Summary";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public GeneratedReport generate(AnalysisDocument document, GeneratorConfig config) {
        StringBuilder md = new StringBuilder();
        md.append("# ").append(document.metadata().description()).append(NEWLINE).append(NEWLINE);
        md.append("Schema version: ").append(document.metadata().schemaVersion()).append(NEWLINE).append(NEWLINE);

        FileBuckets buckets;
        if (document instanceof ArchitectureDocument architecture) {
            appendGeneric(md, architecture.analysis(), config);
            buckets = architecture.analysis().fileBuckets();
        } else if (document instanceof CgraProjectDocument cgra) {
            appendCgra(md, cgra.analysis());
            buckets = cgra.analysis().fileBuckets();
        } else {
            throw new IllegalArgumentException("Unsupported document type: " + document.getClass().getName());
        }

        appendBuckets(md, buckets);
        appendDiagnostics(md, document.diagnostics());

        return new GeneratedReport(config.baseName() + "_summary", md.toString(), getFileExtension(), "text/markdown");
    }

    private void appendGeneric(StringBuilder md, ProjectAnalysis analysis, GeneratorConfig config) {
        md.append("## Totals").append(NEWLINE).append(NEWLINE);
        md.append("| Metric | Count |").append(NEWLINE);
        md.append("|--------|-------|").append(NEWLINE);
        md.append("| Components | ").append(analysis.metrics().totalComponents()).append(" |").append(NEWLINE);
        md.append("| Relationships | ").append(analysis.metrics().totalRelationships()).append(" |").append(NEWLINE);
        md.append("| Control flow patterns | ").append(analysis.metrics().controlFlowCount()).append(" |").append(NEWLINE);
        md.append("| Data flow patterns | ").append(analysis.metrics().dataFlowCount()).append(" |").append(NEWLINE);
        md.append("| State patterns | ").append(analysis.metrics().stateCount()).append(" |").append(NEWLINE);
        md.append(NEWLINE);

        md.append("## Key Components").append(NEWLINE).append(NEWLINE);
        List<String> components = analysis.components();
        if (components.isEmpty()) {
            md.append("_No components found._").append(NEWLINE);
        }
        components.stream()
            .limit(config.topComponents())
            .forEach(name -> md.append("- ").append(name).append(NEWLINE));
        md.append(NEWLINE);

        appendCounts(md, "Control Flow Patterns", analysis.controlFlowPatterns(), FlowPattern::nodeKind);
        appendCounts(md, "Data Flow Patterns", analysis.dataFlowPatterns(),
            pattern -> pattern.direction() == null ? "unknown" : pattern.direction().key());
    }

    private void appendCounts(StringBuilder md, String title, List<FlowPattern> patterns,
                              Function<FlowPattern, String> key) {
        md.append("## ").append(title).append(NEWLINE).append(NEWLINE);
        Map<String, Integer> counts = new TreeMap<>();
        for (FlowPattern pattern : patterns) {
            counts.merge(key.apply(pattern), 1, Integer::sum);
        }
        if (counts.isEmpty()) {
            md.append("_None._").append(NEWLINE);
        }
        counts.forEach((name, count) -> md.append("- ").append(name).append(": ").append(count).append(NEWLINE));
        md.append(NEWLINE);
    }

    private void appendCgra(StringBuilder md, CgraProjectAnalysis analysis) {
        md.append("## Components").append(NEWLINE).append(NEWLINE);
        md.append("Total: ").append(analysis.totalComponents()).append(NEWLINE).append(NEWLINE);

        for (CgraComponentCategory category : CgraComponentCategory.values()) {
            List<CgraComponent> components = analysis.componentsOf(category);
            md.append("### ").append(category.key()).append(" (").append(components.size()).append(")")
                .append(NEWLINE).append(NEWLINE);
            for (CgraComponent component : components) {
                md.append("- `").append(component.name()).append("` (").append(component.nodeKind())
                    .append(", line ").append(component.span().start().row() + 1).append(")");
                if (!component.iface().isEmpty()) {
                    md.append(": ").append(component.iface().parameters().size()).append(" field(s), ")
                        .append(component.iface().methods().size()).append(" method(s)");
                }
                md.append(NEWLINE);
            }
            md.append(NEWLINE);
        }

        md.append("## Channel Events").append(NEWLINE).append(NEWLINE);
        for (ChannelEventKind kind : ChannelEventKind.values()) {
            md.append("- ").append(kind.key()).append(": ").append(analysis.eventsOf(kind).size()).append(NEWLINE);
        }
        md.append(NEWLINE);
    }

    private void appendBuckets(StringBuilder md, FileBuckets buckets) {
        md.append("## Files").append(NEWLINE).append(NEWLINE);
        for (FileBucket bucket : FileBucket.values()) {
            md.append("- ").append(label(bucket)).append(": ").append(buckets.get(bucket).size()).append(NEWLINE);
        }
        md.append(NEWLINE);
    }

    private void appendDiagnostics(StringBuilder md, List<FileFailure> diagnostics) {
        if (diagnostics.isEmpty()) {
            return;
        }
        md.append("## Skipped Files").append(NEWLINE).append(NEWLINE);
        for (FileFailure failure : diagnostics) {
            md.append("- ").append(failure.file()).append(": ").append(failure.reason()).append(NEWLINE);
        }
        md.append(NEWLINE);
    }

    private static String label(FileBucket bucket) {
        return switch (bucket) {
            case TESTS -> "Tests";
            case SAMPLES -> "Samples";
            case CORE_COMPONENTS -> "Core components";
            case UTILITIES -> "Utilities";
        };
    }
}
