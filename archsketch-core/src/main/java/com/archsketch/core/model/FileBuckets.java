package com.archsketch.core.model;

import java.util.List;

/**
 * Relative paths of analysed files grouped by structural role.
 *
 * @param tests test files
 * @param samples sample or example files
 * @param coreComponents files of the core design
 * @param utilities everything else
 */
public record FileBuckets(
    List<String> tests,
    List<String> samples,
    List<String> coreComponents,
    List<String> utilities
) {
    /**
     * Compact constructor with validation.
     */
    public FileBuckets {
        tests = tests == null ? List.of() : List.copyOf(tests);
        samples = samples == null ? List.of() : List.copyOf(samples);
        coreComponents = coreComponents == null ? List.of() : List.copyOf(coreComponents);
        utilities = utilities == null ? List.of() : List.copyOf(utilities);
    }

    /**
     * Returns buckets with no files.
     *
     * @return empty buckets
     */
    public static FileBuckets empty() {
        return new FileBuckets(List.of(), List.of(), List.of(), List.of());
    }

    /**
     * Returns the files of one bucket.
     *
     * @param bucket bucket to read
     * @return relative paths in that bucket
     */
    public List<String> get(FileBucket bucket) {
        return switch (bucket) {
            case TESTS -> tests;
            case SAMPLES -> samples;
            case CORE_COMPONENTS -> coreComponents;
            case UTILITIES -> utilities;
        };
    }

    /**
     * Returns the number of bucketed files.
     *
     * @return total across all buckets
     */
    public int totalFiles() {
        return tests.size() + samples.size() + coreComponents.size() + utilities.size();
    }
}
