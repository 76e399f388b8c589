package com.archsketch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Descriptive block attached to every emitted document.
 *
 * @param description what the document describes
 * @param schemaVersion version of the document layout
 * @param analysisType {@code architecture} or {@code cgra}
 * @param summary headline counts, insertion ordered
 */
public record ReportMetadata(
    String description,
    String schemaVersion,
    String analysisType,
    Map<String, Object> summary
) {
    /**
     * Compact constructor with validation.
     */
    public ReportMetadata {
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(schemaVersion, "schemaVersion must not be null");
        Objects.requireNonNull(analysisType, "analysisType must not be null");
        summary = summary == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(summary));
    }
}
