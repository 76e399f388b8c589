package com.archsketch.core.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;
import java.util.Objects;

/**
 * Generic architecture document: a {@link ProjectAnalysis} plus metadata.
 *
 * <p>Serialises flat, i.e. the analysis fields sit next to {@code metadata}.
 *
 * @param analysis aggregated analysis
 * @param metadata summary metadata
 */
public record ArchitectureDocument(
    @JsonUnwrapped ProjectAnalysis analysis,
    ReportMetadata metadata
) implements AnalysisDocument {

    public ArchitectureDocument {
        Objects.requireNonNull(analysis, "analysis must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
    }

    @Override
    public List<Relationship> relationships() {
        return analysis.relationships();
    }

    @Override
    public List<FileFailure> diagnostics() {
        return analysis.diagnostics();
    }
}
