package com.archsketch.core.config;

import com.archsketch.core.model.CgraComponentCategory;
import com.archsketch.core.model.PatternCategory;
import com.archsketch.core.rules.DefaultRuleTables;
import com.archsketch.core.rules.RuleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Builds effective rule tables: the built-in tables extended by configuration.
 *
 * <p>Extensions append to existing categories; category order never changes. Unknown
 * category keys are logged and ignored.
 */
public final class RuleTables {

    private static final Logger log = LoggerFactory.getLogger(RuleTables.class);

    private RuleTables() {
        // Utility class
    }

    public static RuleTable<PatternCategory> generic(ProjectConfig config) {
        RuleTable<PatternCategory> table = DefaultRuleTables.generic();
        for (Map.Entry<String, ProjectConfig.GenericRuleOverride> entry : config.rules().generic().entrySet()) {
            PatternCategory category;
            try {
                category = PatternCategory.fromKey(entry.getKey());
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring rules for unknown generic category '{}'", entry.getKey());
                continue;
            }
            ProjectConfig.GenericRuleOverride extension = entry.getValue();
            if (extension == null) {
                continue;
            }
            log.debug("Extending generic category {} with identifiers {} and kinds {}",
                category.key(), extension.identifiers(), extension.kinds());
            table = table.extend(category, extension.identifiers(), extension.kinds());
        }
        return table;
    }

    public static RuleTable<CgraComponentCategory> cgra(ProjectConfig config) {
        RuleTable<CgraComponentCategory> table = DefaultRuleTables.cgra();
        for (Map.Entry<String, List<String>> entry : config.rules().cgra().entrySet()) {
            CgraComponentCategory category;
            try {
                category = CgraComponentCategory.fromKey(entry.getKey());
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring rules for unknown CGRA category '{}'", entry.getKey());
                continue;
            }
            if (entry.getValue() == null) {
                continue;
            }
            log.debug("Extending CGRA category {} with keywords {}", category.key(), entry.getValue());
            table = table.extend(category, entry.getValue(), List.of());
        }
        return table;
    }
}
