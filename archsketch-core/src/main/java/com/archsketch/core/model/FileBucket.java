package com.archsketch.core.model;

/**
 * Structural role of a source file within a project.
 */
public enum FileBucket {
    TESTS,
    SAMPLES,
    CORE_COMPONENTS,
    UTILITIES
}
