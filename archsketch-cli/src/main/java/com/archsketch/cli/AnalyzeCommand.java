package com.archsketch.cli;

import com.archsketch.core.aggregation.AggregationEngine;
import com.archsketch.core.aggregation.SourceFile;
import com.archsketch.core.aggregation.impl.GenericArchitectureProfile;
import com.archsketch.core.classifier.NodeClassifier;
import com.archsketch.core.config.ProjectConfig;
import com.archsketch.core.config.RuleTables;
import com.archsketch.core.model.AnalysisDocument;
import com.archsketch.core.model.ProjectAnalysis;
import com.archsketch.core.report.ReportAssembler;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * Generic architecture analysis.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * archsketch analyze ./asts
 * archsketch analyze core_analysis.json --format json --format mermaid -o out
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Classify components and flow patterns across syntax-tree bundles",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand extends AbstractAnalysisCommand {

    @Override
    protected AnalysisDocument analyze(ProjectConfig config, List<SourceFile> files, AggregationEngine engine) {
        NodeClassifier classifier = new NodeClassifier(RuleTables.generic(config));
        GenericArchitectureProfile profile =
            new GenericArchitectureProfile(classifier, config.analysis().includesOrphans());
        ProjectAnalysis analysis = engine.run(profile, files);
        return ReportAssembler.assemble(analysis, description(config, ReportAssembler.GENERIC_DESCRIPTION));
    }

    @Override
    protected String reportBaseName() {
        return "architecture_analysis";
    }

    @Override
    protected String label() {
        return "Architecture";
    }
}
