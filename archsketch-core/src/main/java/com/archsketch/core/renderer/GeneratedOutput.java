package com.archsketch.core.renderer;

import com.archsketch.core.generator.GeneratedReport;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Set of files produced by one run.
 *
 * @param files files in generation order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput of(List<GeneratedReport> reports) {
        return new GeneratedOutput(reports.stream().map(GeneratedFile::of).collect(Collectors.toList()));
    }
}
