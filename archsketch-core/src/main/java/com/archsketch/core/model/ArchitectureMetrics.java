package com.archsketch.core.model;

/**
 * Summary counts of a generic architecture analysis.
 *
 * <p>Each value is the literal size of the corresponding collection of the analysis.
 *
 * @param totalComponents size of the component set
 * @param totalRelationships number of raw relationships
 * @param controlFlowCount number of control-flow patterns
 * @param dataFlowCount number of data-flow patterns
 * @param stateCount number of state patterns
 */
public record ArchitectureMetrics(
    int totalComponents,
    int totalRelationships,
    int controlFlowCount,
    int dataFlowCount,
    int stateCount
) {
    /**
     * Compact constructor with validation.
     */
    public ArchitectureMetrics {
        if (totalComponents < 0 || totalRelationships < 0 || controlFlowCount < 0
            || dataFlowCount < 0 || stateCount < 0) {
            throw new IllegalArgumentException("metrics must be >= 0");
        }
    }

    /**
     * Metrics of an empty analysis.
     *
     * @return all-zero metrics
     */
    public static ArchitectureMetrics zero() {
        return new ArchitectureMetrics(0, 0, 0, 0, 0);
    }
}
