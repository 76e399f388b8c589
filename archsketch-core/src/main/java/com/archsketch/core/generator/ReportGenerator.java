package com.archsketch.core.generator;

import com.archsketch.core.model.AnalysisDocument;

/**
 * Turns an analysis document into one output file.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and selected by
 * {@link #getId()} from the configured output formats.
 */
public interface ReportGenerator {

    /**
     * Returns the unique identifier of this generator, e.g. {@code json} or {@code mermaid}.
     *
     * @return generator identifier
     */
    String getId();

    /**
     * Returns a human-readable name for CLI output.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the extension of generated files, without the dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Generates the report.
     *
     * @param document generic or CGRA document
     * @param config generator settings
     * @return generated report
     */
    GeneratedReport generate(AnalysisDocument document, GeneratorConfig config);
}
