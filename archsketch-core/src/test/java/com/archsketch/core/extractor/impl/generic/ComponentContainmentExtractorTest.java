package com.archsketch.core.extractor.impl.generic;

import com.archsketch.core.classifier.NodeClassifier;
import com.archsketch.core.model.Relationship;
import com.archsketch.core.model.RelationshipKind;
import com.archsketch.core.model.SyntaxNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.archsketch.core.TreeFixtures.clusterScenario;
import static com.archsketch.core.TreeFixtures.deepChain;
import static com.archsketch.core.TreeFixtures.leaf;
import static com.archsketch.core.TreeFixtures.named;
import static com.archsketch.core.TreeFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link ComponentContainmentExtractor}.
 */
class ComponentContainmentExtractorTest {

    private ComponentContainmentExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ComponentContainmentExtractor(new NodeClassifier());
    }

    @Test
    void extract_nestedComponents_emitsContainsRelationship() {
        // Given: ClusterModule containing ProcessingElementPE0
        SyntaxNode tree = clusterScenario();

        // When
        List<Relationship> relationships = extractor.extract(tree);

        // Then
        assertThat(relationships).containsExactly(
            new Relationship("ClusterModule", "ProcessingElementPE0", RelationshipKind.CONTAINS));
    }

    @Test
    void extract_topLevelComponentAlone_emitsNoRelationship() {
        // Given: a component with no enclosing component
        SyntaxNode tree = node("source_file", named("struct_type", "LonelyEngine"));

        // When
        List<Relationship> relationships = extractor.extract(tree);

        // Then: the orphan is not visible through relationships
        assertThat(relationships).isEmpty();
    }

    @Test
    void extract_unnamedInnerComponent_keepsOuterContext() {
        // Given: outer Cluster > unnamed struct > named Tile
        SyntaxNode tree = named("struct_type", "Cluster",
            node("struct_type",
                named("struct_type", "Tile")));

        // When
        List<Relationship> relationships = extractor.extract(tree);

        // Then: the unnamed struct yields an edge with no target and Tile hangs off Cluster
        assertThat(relationships).containsExactly(
            Relationship.contains("Cluster", null),
            Relationship.contains("Cluster", "Tile"));
    }

    @Test
    void extract_siblingsShareTheEnclosingComponent() {
        SyntaxNode tree = named("struct_type", "Array",
            named("struct_type", "RowA"),
            named("struct_type", "RowB"));

        assertThat(extractor.extract(tree)).extracting(Relationship::to).containsExactly("RowA", "RowB");
    }

    @Test
    void extract_componentBuriedInDeepTree_isStillFound() {
        SyntaxNode tree = named("struct_type", "Top",
            deepChain(50_000, named("struct_type", "Bottom", leaf("comment", "//"))));

        assertThat(extractor.extract(tree)).containsExactly(Relationship.contains("Top", "Bottom"));
    }
}
