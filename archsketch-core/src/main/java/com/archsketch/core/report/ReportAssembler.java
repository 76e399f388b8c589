package com.archsketch.core.report;

import com.archsketch.core.model.ArchitectureDocument;
import com.archsketch.core.model.ArchitectureMetrics;
import com.archsketch.core.model.CgraComponentCategory;
import com.archsketch.core.model.CgraProjectAnalysis;
import com.archsketch.core.model.CgraProjectDocument;
import com.archsketch.core.model.ProjectAnalysis;
import com.archsketch.core.model.ReportMetadata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wraps finished analyses with {@link ReportMetadata}.
 *
 * <p>Summary values are copies of numbers already in the analysis; nothing is recomputed
 * from the trees.
 */
public final class ReportAssembler {

    public static final String SCHEMA_VERSION = "1.0";
    public static final String GENERIC_DESCRIPTION = "Code Architecture Analysis";
    public static final String CGRA_DESCRIPTION = "CGRA Architecture Analysis";

    private ReportAssembler() {
        // Utility class
    }

    public static ArchitectureDocument assemble(ProjectAnalysis analysis) {
        return assemble(analysis, GENERIC_DESCRIPTION);
    }

    public static ArchitectureDocument assemble(ProjectAnalysis analysis, String description) {
        ArchitectureMetrics metrics = analysis.metrics();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("components", metrics.totalComponents());
        summary.put("relationships", metrics.totalRelationships());
        summary.put("controlFlowPatterns", metrics.controlFlowCount());
        summary.put("dataFlowPatterns", metrics.dataFlowCount());
        summary.put("statePatterns", metrics.stateCount());

        return new ArchitectureDocument(
            analysis,
            new ReportMetadata(description, SCHEMA_VERSION, "architecture", summary)
        );
    }

    public static CgraProjectDocument assemble(CgraProjectAnalysis analysis) {
        return assemble(analysis, CGRA_DESCRIPTION);
    }

    public static CgraProjectDocument assemble(CgraProjectAnalysis analysis, String description) {
        List<String> componentTypes = new ArrayList<>();
        for (CgraComponentCategory category : CgraComponentCategory.values()) {
            if (!analysis.componentsOf(category).isEmpty()) {
                componentTypes.add(category.key());
            }
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totalComponents", analysis.totalComponents());
        summary.put("componentTypes", List.copyOf(componentTypes));
        summary.put("relationships", analysis.relationships().size());
        summary.put("channelEvents", analysis.totalChannelEvents());
        summary.put("filesAnalyzed", analysis.fileBuckets().totalFiles());
        summary.put("filesFailed", analysis.diagnostics().size());

        return new CgraProjectDocument(
            analysis,
            new ReportMetadata(description, SCHEMA_VERSION, "cgra", summary)
        );
    }
}
