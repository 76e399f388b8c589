package com.archsketch.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CgraProjectAnalysis}.
 */
class CgraProjectAnalysisTest {

    @Test
    void constructor_withSparseMaps_holdsEveryCategoryAndEventKind() {
        CgraComponent router = new CgraComponent(CgraComponentCategory.INTERCONNECT, "MeshRouter",
            "type_identifier", Span.EMPTY, null);

        CgraProjectAnalysis analysis = new CgraProjectAnalysis(
            Map.of("interconnects", List.of(router)),
            null,
            Map.of("send", List.of(new ChannelEvent(ChannelEventKind.SEND, Span.EMPTY))),
            null,
            null
        );

        assertThat(analysis.components()).containsOnlyKeys(
            "processing_elements", "interconnects", "memories", "controls", "configurations");
        assertThat(analysis.components().keySet()).containsExactly(
            "processing_elements", "interconnects", "memories", "controls", "configurations");
        assertThat(analysis.componentsOf(CgraComponentCategory.INTERCONNECT)).containsExactly(router);
        assertThat(analysis.componentsOf(CgraComponentCategory.MEMORY)).isEmpty();
        assertThat(analysis.dataflow().keySet()).containsExactly("send", "receive");
        assertThat(analysis.totalComponents()).isEqualTo(1);
        assertThat(analysis.totalChannelEvents()).isEqualTo(1);
        assertThat(analysis.fileBuckets().totalFiles()).isZero();
    }
}
