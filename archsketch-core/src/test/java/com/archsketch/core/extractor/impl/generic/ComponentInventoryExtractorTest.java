package com.archsketch.core.extractor.impl.generic;

import com.archsketch.core.classifier.NodeClassifier;
import com.archsketch.core.model.ComponentRecord;
import org.junit.jupiter.api.Test;

import static com.archsketch.core.TreeFixtures.at;
import static com.archsketch.core.TreeFixtures.named;
import static com.archsketch.core.TreeFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link ComponentInventoryExtractor}.
 */
class ComponentInventoryExtractorTest {

    private final ComponentInventoryExtractor extractor = new ComponentInventoryExtractor(new NodeClassifier());

    @Test
    void extract_listsTopLevelComponents() {
        // Given: an orphan component next to a nested pair
        var tree = node("source_file",
            at(named("struct_type", "LonelyEngine"), 3),
            named("struct_type", "Cluster", named("struct_type", "Tile")));

        // When
        var records = extractor.extract(tree);

        // Then
        assertThat(records).extracting(ComponentRecord::name)
            .containsExactly("LonelyEngine", "Cluster", "Tile");
        assertThat(records.get(0).span().start().row()).isEqualTo(3);
        assertThat(extractor.getId()).isEqualTo("component-inventory");
    }
}
