package com.archsketch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ArchSketch CLI")
class ArchSketchCLITest {

    private static final String BUNDLE = """
        {
          "component": "cluster",
          "analysis": [
            {
              "file": "cluster/cluster.go",
              "ast": {
                "kind": "struct_type",
                "text": "ClusterController",
                "children": [
                  {"kind": "struct_type", "text": "ProcessingElementPE0"},
                  {"kind": "send_statement"}
                ]
              }
            }
          ]
        }
        """;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureStdout() {
        originalOut = System.out;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStdout() {
        System.setOut(originalOut);
    }

    private Path writeBundle() throws IOException {
        Path bundle = tempDir.resolve("cluster.json");
        Files.writeString(bundle, BUNDLE);
        return bundle;
    }

    private String config() {
        return tempDir.resolve("absent.yaml").toString();
    }

    @Test
    @DisplayName("analyze writes all default reports")
    void analyze_bundle_writesReports() throws IOException {
        // Given
        Path bundle = writeBundle();
        Path out = tempDir.resolve("out");

        // When
        int exitCode = ArchSketchCLI.commandLine().execute(
            "analyze", bundle.toString(), "-c", config(), "-o", out.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.resolve("architecture_analysis.json")).exists();
        assertThat(out.resolve("architecture_analysis_summary.md")).exists();
        assertThat(out.resolve("architecture_analysis_graph.md")).exists();
        assertThat(Files.readString(out.resolve("architecture_analysis.json")))
            .contains("\"ClusterController\"", "\"ProcessingElementPE0\"");
        assertThat(stdout.toString(StandardCharsets.UTF_8)).contains("Architecture Summary:");
    }

    @Test
    @DisplayName("cgra honours --format and --parallel")
    void cgra_singleFormat_writesOnlyJson() throws IOException {
        Path bundle = writeBundle();
        Path out = tempDir.resolve("cgra");

        int exitCode = ArchSketchCLI.commandLine().execute(
            "cgra", bundle.toString(), "-c", config(), "-o", out.toString(), "--format", "json", "--parallel");

        assertThat(exitCode).isZero();
        assertThat(out.resolve("cgra_analysis.json")).exists();
        assertThat(out.resolve("cgra_analysis_summary.md")).doesNotExist();
        assertThat(Files.readString(out.resolve("cgra_analysis.json")))
            .contains("\"processing_elements\"", "\"controls\"", "\"send\"");
    }

    @Test
    @DisplayName("missing input fails with exit code 1")
    void analyze_missingInput_returnsOne() {
        int exitCode = ArchSketchCLI.commandLine().execute(
            "analyze", tempDir.resolve("nope").toString(), "-c", config(), "-o", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    @DisplayName("rules prints both tables")
    void rules_printsTables() {
        int exitCode = ArchSketchCLI.commandLine().execute("rules", "-c", config());

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8))
            .contains("Generic rules:")
            .contains("CGRA rules (priority order):")
            .contains("PROCESSING_ELEMENT");
    }
}
