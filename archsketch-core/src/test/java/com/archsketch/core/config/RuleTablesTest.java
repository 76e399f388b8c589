package com.archsketch.core.config;

import com.archsketch.core.classifier.CgraComponentClassifier;
import com.archsketch.core.classifier.NodeClassifier;
import com.archsketch.core.model.CgraComponentCategory;
import com.archsketch.core.model.PatternCategory;
import com.archsketch.core.rules.DefaultRuleTables;
import com.archsketch.core.rules.RuleTable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.archsketch.core.TreeFixtures.leaf;
import static com.archsketch.core.TreeFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;

class RuleTablesTest {

    private static ProjectConfig withRules(ProjectConfig.RuleOverrides rules) {
        return new ProjectConfig(null, null, rules, null);
    }

    @Test
    void generic_noOverrides_returnsDefaults() {
        RuleTable<PatternCategory> table = RuleTables.generic(ProjectConfig.defaults());

        assertThat(table.entries()).isEqualTo(DefaultRuleTables.generic().entries());
    }

    @Test
    void generic_override_appendsKeywordsAndKinds() {
        // Given
        ProjectConfig config = withRules(new ProjectConfig.RuleOverrides(
            Map.of("component", new ProjectConfig.GenericRuleOverride(List.of("Tile"), List.of("impl_item"))),
            null));

        // When
        NodeClassifier classifier = new NodeClassifier(RuleTables.generic(config));

        // Then
        assertThat(classifier.classify(leaf("identifier", "MeshTile"), PatternCategory.COMPONENT)).isTrue();
        assertThat(classifier.classify(node("impl_item"), PatternCategory.COMPONENT)).isTrue();
        assertThat(classifier.classify(node("struct_type"), PatternCategory.COMPONENT)).isTrue();
    }

    @Test
    void generic_unknownCategory_isSkipped() {
        ProjectConfig config = withRules(new ProjectConfig.RuleOverrides(
            Map.of("wiring", new ProjectConfig.GenericRuleOverride(List.of("wire"), null)),
            null));

        assertThat(RuleTables.generic(config).entries()).isEqualTo(DefaultRuleTables.generic().entries());
    }

    @Test
    void cgra_override_acceptsSingularCategoryName() {
        ProjectConfig config = withRules(new ProjectConfig.RuleOverrides(
            null,
            Map.of("memory", List.of("Scratchpad"), "bogus", List.of("x"))));

        CgraComponentClassifier classifier = new CgraComponentClassifier(RuleTables.cgra(config));

        assertThat(classifier.classify(leaf("type_identifier", "Scratchpad0"))).contains(CgraComponentCategory.MEMORY);
    }
}
