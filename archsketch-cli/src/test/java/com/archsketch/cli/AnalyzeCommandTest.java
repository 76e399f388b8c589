package com.archsketch.cli;

import com.archsketch.core.config.ConfigLoader;
import com.archsketch.core.config.ProjectConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests how the analysis commands combine command-line flags with configuration.
 */
class AnalyzeCommandTest {

    @TempDir
    Path tempDir;

    private ProjectConfig configWithParallel(boolean parallel) throws IOException {
        Path file = tempDir.resolve("archsketch.yaml");
        Files.writeString(file, "analysis:\n  parallel: " + parallel + "\n");
        return ConfigLoader.load(file);
    }

    private AnalyzeCommand parse(String... args) {
        AnalyzeCommand command = new AnalyzeCommand();
        new CommandLine(command).parseArgs(args);
        return command;
    }

    @Test
    void resolveParallel_noParallelFlag_overridesConfig() throws IOException {
        // Given
        ProjectConfig config = configWithParallel(true);

        // When
        AnalyzeCommand command = parse("bundle.json", "--no-parallel");

        // Then
        assertThat(config.analysis().isParallel()).isTrue();
        assertThat(command.resolveParallel(config)).isFalse();
    }

    @Test
    void resolveParallel_parallelFlag_overridesConfig() throws IOException {
        ProjectConfig config = configWithParallel(false);

        AnalyzeCommand command = parse("bundle.json", "--parallel");

        assertThat(command.resolveParallel(config)).isTrue();
    }

    @Test
    void resolveParallel_flagAbsent_followsConfig() throws IOException {
        AnalyzeCommand command = parse("bundle.json");

        assertThat(command.resolveParallel(configWithParallel(true))).isTrue();
        assertThat(command.resolveParallel(configWithParallel(false))).isFalse();
    }
}
