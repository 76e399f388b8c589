package com.archsketch.core.generator.impl;

import com.archsketch.core.aggregation.AggregationEngine;
import com.archsketch.core.aggregation.SourceFile;
import com.archsketch.core.aggregation.impl.CgraProjectProfile;
import com.archsketch.core.aggregation.impl.GenericArchitectureProfile;
import com.archsketch.core.generator.GeneratedReport;
import com.archsketch.core.generator.GeneratorConfig;
import com.archsketch.core.report.ReportAssembler;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.archsketch.core.TreeFixtures.clusterScenario;
import static com.archsketch.core.TreeFixtures.named;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MermaidGraphGenerator}.
 */
class MermaidGraphGeneratorTest {

    private final MermaidGraphGenerator generator = new MermaidGraphGenerator();

    @Test
    void generate_genericDocument_drawsContainmentEdges() {
        // Given
        var analysis = new AggregationEngine().run(new GenericArchitectureProfile(),
            List.of(SourceFile.parsed("cluster", "cluster/cluster.go", clusterScenario())));

        // When
        GeneratedReport report = generator.generate(ReportAssembler.assemble(analysis), GeneratorConfig.defaults());

        // Then
        assertThat(report.fileName()).isEqualTo("architecture_analysis_graph.md");
        assertThat(report.content())
            .contains("```mermaid")
            .contains("graph TB")
            .contains("  ClusterModule[\"ClusterModule\"]")
            .contains("  ClusterModule -->|contains| ProcessingElementPE0");
    }

    @Test
    void generate_emptyAnalysis_drawsPlaceholder() {
        var analysis = new AggregationEngine().run(new GenericArchitectureProfile(), List.of());

        GeneratedReport report = generator.generate(ReportAssembler.assemble(analysis), GeneratorConfig.defaults());

        assertThat(report.content()).contains("empty[No components found]");
    }

    @Test
    void generate_cgraDocument_buildsGraphFromRelationships() {
        var analysis = new AggregationEngine().run(new CgraProjectProfile(), List.of(
            SourceFile.parsed("c", "c/ctl.go", named("struct_type", "Main-Controller",
                named("struct_type", "PE 0")))));

        GeneratedReport report = generator.generate(ReportAssembler.assemble(analysis),
            new GeneratorConfig("cgra_analysis", 10, Map.of("mermaid.direction", "LR")));

        assertThat(report.content())
            .contains("graph LR")
            .contains("  controls[\"controls\"]")
            .contains("  processing_elements[\"processing_elements\"]")
            .contains("  controls -->|contains| processing_elements");
    }

    @Test
    void generate_collidingSanitisedNames_getDistinctIds() {
        var analysis = new AggregationEngine().run(new GenericArchitectureProfile(), List.of(
            SourceFile.parsed("m", "m/m.go", named("struct_type", "Core.Unit",
                named("struct_type", "Core_Unit")))));

        GeneratedReport report = generator.generate(ReportAssembler.assemble(analysis), GeneratorConfig.defaults());

        assertThat(report.content())
            .contains("  Core_Unit[\"Core.Unit\"]")
            .contains("  Core_Unit_2[\"Core_Unit\"]")
            .contains("  Core_Unit -->|contains| Core_Unit_2");
    }
}
