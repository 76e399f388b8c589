package com.archsketch.core.model;

import java.util.List;

/**
 * Common view of the documents handed to generators.
 */
public interface AnalysisDocument {

    /**
     * Returns the metadata block.
     *
     * @return metadata
     */
    ReportMetadata metadata();

    /**
     * Returns the raw containment relationships of the document.
     *
     * @return relationships
     */
    List<Relationship> relationships();

    /**
     * Returns the files skipped while building the document.
     *
     * @return diagnostics
     */
    List<FileFailure> diagnostics();
}
