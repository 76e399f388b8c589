package com.archsketch.core.report;

import com.archsketch.core.aggregation.AggregationEngine;
import com.archsketch.core.aggregation.SourceFile;
import com.archsketch.core.aggregation.impl.CgraProjectProfile;
import com.archsketch.core.aggregation.impl.GenericArchitectureProfile;
import com.archsketch.core.model.ArchitectureDocument;
import com.archsketch.core.model.CgraProjectDocument;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.archsketch.core.TreeFixtures.clusterScenario;
import static com.archsketch.core.TreeFixtures.named;
import static com.archsketch.core.TreeFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;

class ReportAssemblerTest {

    @Test
    void assemble_genericAnalysis_summarisesMetrics() {
        // Given
        var analysis = new AggregationEngine().run(new GenericArchitectureProfile(),
            List.of(SourceFile.parsed("cluster", "cluster/cluster.go", clusterScenario())));

        // When
        ArchitectureDocument document = ReportAssembler.assemble(analysis);

        // Then
        assertThat(document.metadata().description()).isEqualTo(ReportAssembler.GENERIC_DESCRIPTION);
        assertThat(document.metadata().schemaVersion()).isEqualTo("1.0");
        assertThat(document.metadata().analysisType()).isEqualTo("architecture");
        assertThat(document.metadata().summary()).containsExactly(
            entry("components", 2),
            entry("relationships", 1),
            entry("controlFlowPatterns", 0),
            entry("dataFlowPatterns", 0),
            entry("statePatterns", 0));
        assertThat(document.relationships()).isEqualTo(analysis.relationships());
    }

    @Test
    void assemble_cgraAnalysis_listsOnlyPopulatedCategories() {
        var analysis = new AggregationEngine().run(new CgraProjectProfile(), List.of(
            SourceFile.parsed("pe", "pe/pe.go", named("struct_type", "ProcessingElement", node("send_statement"))),
            SourceFile.failed("pe", "pe/bad.go", "unreadable bundle")));

        CgraProjectDocument document = ReportAssembler.assemble(analysis, "Fabric");

        assertThat(document.metadata().description()).isEqualTo("Fabric");
        assertThat(document.metadata().analysisType()).isEqualTo("cgra");
        assertThat(document.metadata().summary())
            .containsEntry("totalComponents", 1)
            .containsEntry("componentTypes", List.of("processing_elements"))
            .containsEntry("relationships", 0)
            .containsEntry("channelEvents", 1)
            .containsEntry("filesAnalyzed", 1)
            .containsEntry("filesFailed", 1);
    }

    private static Map.Entry<String, Object> entry(String key, Object value) {
        return Map.entry(key, value);
    }
}
