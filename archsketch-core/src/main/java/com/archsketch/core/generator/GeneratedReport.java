package com.archsketch.core.generator;

import java.util.Objects;

/**
 * Content produced by a {@link ReportGenerator}.
 *
 * @param name base file name without extension
 * @param content file content
 * @param fileExtension extension without the dot
 * @param contentType MIME type
 */
public record GeneratedReport(
    String name,
    String content,
    String fileExtension,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedReport {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
        if (contentType == null) {
            contentType = "text/plain";
        }
    }

    public String fileName() {
        return name + "." + fileExtension;
    }
}
