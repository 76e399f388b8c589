package com.archsketch.core.generator.impl;

import com.archsketch.core.aggregation.AggregationEngine;
import com.archsketch.core.aggregation.SourceFile;
import com.archsketch.core.aggregation.impl.CgraProjectProfile;
import com.archsketch.core.aggregation.impl.GenericArchitectureProfile;
import com.archsketch.core.generator.GeneratedReport;
import com.archsketch.core.generator.GeneratorConfig;
import com.archsketch.core.report.ReportAssembler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.archsketch.core.TreeFixtures.clusterScenario;
import static com.archsketch.core.TreeFixtures.leaf;
import static com.archsketch.core.TreeFixtures.named;
import static com.archsketch.core.TreeFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JsonReportGenerator}.
 */
class JsonReportGeneratorTest {

    private final JsonReportGenerator generator = new JsonReportGenerator();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void generate_genericDocument_writesFlatJson() throws Exception {
        // Given
        var analysis = new AggregationEngine().run(new GenericArchitectureProfile(),
            List.of(SourceFile.parsed("cluster", "cluster/cluster.go", clusterScenario())));

        // When
        GeneratedReport report = generator.generate(ReportAssembler.assemble(analysis), GeneratorConfig.defaults());

        // Then
        assertThat(report.fileName()).isEqualTo("architecture_analysis.json");
        JsonNode json = mapper.readTree(report.content());
        assertThat(json.path("metadata").path("analysisType").asText()).isEqualTo("architecture");
        assertThat(json.path("components")).hasSize(2);
        assertThat(json.path("relationships").get(0).path("from").asText()).isEqualTo("ClusterModule");
        assertThat(json.path("relationships").get(0).path("kind").asText()).isEqualTo("contains");
        assertThat(json.path("metrics").path("totalRelationships").asInt()).isEqualTo(1);
        assertThat(json.has("analysis")).isFalse();
    }

    @Test
    void generate_cgraDocument_usesCategoryKeys() throws Exception {
        var analysis = new AggregationEngine().run(new CgraProjectProfile(), List.of(
            SourceFile.parsed("pe", "pe/pe.go", node("source_file",
                named("struct_type", "ProcessingElement",
                    node("field_declaration", leaf("field_identifier", "Id"), leaf("type_identifier", "int"))),
                node("receive_statement")))));

        GeneratedReport report = generator.generate(ReportAssembler.assemble(analysis), GeneratorConfig.named("cgra_analysis"));

        JsonNode json = mapper.readTree(report.content());
        assertThat(report.fileName()).isEqualTo("cgra_analysis.json");
        assertThat(json.path("components").path("processing_elements")).hasSize(1);
        assertThat(json.path("components").path("processing_elements").get(0).path("category").asText())
            .isEqualTo("processing_elements");
        assertThat(json.path("components").path("memories")).isEmpty();
        assertThat(json.path("dataflow").path("receive")).hasSize(1);
        assertThat(json.path("metadata").path("summary").path("componentTypes").get(0).asText())
            .isEqualTo("processing_elements");
    }
}
