package com.archsketch.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("archsketch.yaml");
        Files.writeString(configFile, """
            project:
              name: "Fabric"
              description: "4x4 CGRA fabric"

            analysis:
              parallel: true
              includeOrphanComponents: true

            rules:
              generic:
                component:
                  identifiers: [tile]
                  kinds: [impl_item]
              cgra:
                memories: [Scratchpad]

            output:
              directory: "./out"
              formats:
                - json
                - mermaid
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("Fabric");
        assertThat(config.project().description()).isEqualTo("4x4 CGRA fabric");
        assertThat(config.analysis().isParallel()).isTrue();
        assertThat(config.analysis().includesOrphans()).isTrue();
        assertThat(config.rules().generic().get("component").identifiers()).containsExactly("tile");
        assertThat(config.rules().generic().get("component").kinds()).containsExactly("impl_item");
        assertThat(config.rules().cgra().get("memories")).containsExactly("Scratchpad");
        assertThat(config.output().directory()).isEqualTo("./out");
        assertThat(config.output().formats()).containsExactly("json", "mermaid");
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("archsketch.yaml");
        Files.writeString(configFile, """
            project:
              name: "Minimal"
            unknownSection:
              ignored: true
            """);

        ProjectConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("Minimal");
        assertThat(config.project().description()).isNull();
        assertThat(config.analysis().isParallel()).isFalse();
        assertThat(config.rules().generic()).isEmpty();
        assertThat(config.output().directory()).isEqualTo(ProjectConfig.DEFAULT_OUTPUT_DIRECTORY);
        assertThat(config.output().formats()).isEqualTo(ProjectConfig.DEFAULT_FORMATS);
    }

    @Test
    void load_missingFile_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(ProjectConfig.defaults());
        assertThat(config.project().name()).isEqualTo("project");
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("archsketch.yaml");
        Files.writeString(configFile, """
            project:
              name: "Broken
              description: [unclosed
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("archsketch.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ProjectConfig.defaults());
    }
}
