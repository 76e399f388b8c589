package com.archsketch.core.renderer;

import com.archsketch.core.generator.GeneratedReport;

import java.util.Objects;

/**
 * File ready to be rendered.
 *
 * @param relativePath path below the output directory
 * @param content file content
 * @param contentType MIME type
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static GeneratedFile of(GeneratedReport report) {
        return new GeneratedFile(report.fileName(), report.content(), report.contentType());
    }
}
