package com.archsketch.core.classifier;

import com.archsketch.core.model.FlowDirection;
import com.archsketch.core.model.SyntaxNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DirectionResolver}.
 */
class DirectionResolverTest {

    @Test
    void resolve_inAndOutCues_inboundWins() {
        assertThat(DirectionResolver.resolve(SyntaxNode.leaf("identifier", "data_in_out_buffer")))
            .isEqualTo(FlowDirection.IN);
    }

    @Test
    void resolve_outboundCueOnly_isOut() {
        assertThat(DirectionResolver.resolve(SyntaxNode.leaf("identifier", "SendQueue")))
            .isEqualTo(FlowDirection.OUT);
    }

    @Test
    void resolve_noCue_isBidirectional() {
        assertThat(DirectionResolver.resolve(SyntaxNode.leaf("identifier", "buffer")))
            .isEqualTo(FlowDirection.BIDIRECTIONAL);
    }

    @Test
    void resolve_missingText_isBidirectional() {
        assertThat(DirectionResolver.resolve(SyntaxNode.branch("field_declaration")))
            .isEqualTo(FlowDirection.BIDIRECTIONAL);
    }
}
