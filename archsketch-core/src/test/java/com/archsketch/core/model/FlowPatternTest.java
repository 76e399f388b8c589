package com.archsketch.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FlowPattern}.
 */
class FlowPatternTest {

    @Test
    void constructor_directionOnDataFlow_isAccepted() {
        FlowPattern pattern = new FlowPattern(PatternCategory.DATA_FLOW, "inputPort", "field_declaration",
            null, FlowDirection.IN);

        assertThat(pattern.direction()).isEqualTo(FlowDirection.IN);
        assertThat(pattern.span()).isEqualTo(Span.EMPTY);
    }

    @Test
    void constructor_directionOnControlFlow_throws() {
        assertThatThrownBy(() -> new FlowPattern(PatternCategory.CONTROL_FLOW, "Tick", "function_declaration",
            Span.EMPTY, FlowDirection.OUT))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_missingName_isAllowed() {
        FlowPattern pattern = new FlowPattern(PatternCategory.STATE, null, "const_declaration", Span.EMPTY, null);

        assertThat(pattern.name()).isNull();
        assertThat(pattern.direction()).isNull();
    }
}
