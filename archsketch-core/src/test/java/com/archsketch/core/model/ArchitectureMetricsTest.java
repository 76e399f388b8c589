package com.archsketch.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ArchitectureMetrics}.
 */
class ArchitectureMetricsTest {

    @Test
    void zero_hasAllCountsZero() {
        ArchitectureMetrics metrics = ArchitectureMetrics.zero();

        assertThat(metrics.totalComponents()).isZero();
        assertThat(metrics.totalRelationships()).isZero();
        assertThat(metrics.controlFlowCount()).isZero();
        assertThat(metrics.dataFlowCount()).isZero();
        assertThat(metrics.stateCount()).isZero();
    }

    @Test
    void constructor_negativeCount_throws() {
        assertThatThrownBy(() -> new ArchitectureMetrics(-1, 0, 0, 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
