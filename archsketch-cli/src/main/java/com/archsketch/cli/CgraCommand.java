package com.archsketch.cli;

import com.archsketch.core.aggregation.AggregationEngine;
import com.archsketch.core.aggregation.SourceFile;
import com.archsketch.core.aggregation.impl.CgraProjectProfile;
import com.archsketch.core.classifier.CgraComponentClassifier;
import com.archsketch.core.config.ProjectConfig;
import com.archsketch.core.config.RuleTables;
import com.archsketch.core.model.AnalysisDocument;
import com.archsketch.core.model.CgraProjectAnalysis;
import com.archsketch.core.report.ReportAssembler;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CGRA project analysis: processing elements, interconnects, memories, controllers and
 * configuration blocks, with their interfaces and channel events.
 */
@Command(
    name = "cgra",
    description = "Classify CGRA hardware components and channel events",
    mixinStandardHelpOptions = true
)
public class CgraCommand extends AbstractAnalysisCommand {

    @Override
    protected AnalysisDocument analyze(ProjectConfig config, List<SourceFile> files, AggregationEngine engine) {
        CgraComponentClassifier classifier = new CgraComponentClassifier(RuleTables.cgra(config));
        CgraProjectAnalysis analysis = engine.run(new CgraProjectProfile(classifier), files);
        return ReportAssembler.assemble(analysis, description(config, ReportAssembler.CGRA_DESCRIPTION));
    }

    @Override
    protected String reportBaseName() {
        return "cgra_analysis";
    }

    @Override
    protected String label() {
        return "CGRA";
    }
}
