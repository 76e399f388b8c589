package com.archsketch.core.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;
import java.util.Objects;

/**
 * CGRA project document: a {@link CgraProjectAnalysis} plus metadata.
 *
 * @param analysis aggregated CGRA analysis
 * @param metadata summary metadata
 */
public record CgraProjectDocument(
    @JsonUnwrapped CgraProjectAnalysis analysis,
    ReportMetadata metadata
) implements AnalysisDocument {

    public CgraProjectDocument {
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
