package com.archsketch.core.classifier;

import com.archsketch.core.model.CgraComponentCategory;
import com.archsketch.core.model.SyntaxNode;
import com.archsketch.core.rules.DefaultRuleTables;
import com.archsketch.core.rules.RuleEntry;
import com.archsketch.core.rules.RuleTable;

import java.util.Objects;
import java.util.Optional;

/**
 * Exclusive, priority-ordered CGRA classifier.
 *
 * <p>Only nodes with text are considered. Categories are tested in table order and the
 * first one with a keyword contained in the case-folded text wins; later categories are
 * not evaluated. With the built-in table {@code PEController} is therefore a processing
 * element, not a controller.
 */
public class CgraComponentClassifier {

    private final RuleTable<CgraComponentCategory> rules;

    public CgraComponentClassifier() {
        this(DefaultRuleTables.cgra());
    }

    /**
     * Creates a classifier backed by the given table.
     *
     * @param rules CGRA table in priority order
     */
    public CgraComponentClassifier(RuleTable<CgraComponentCategory> rules) {
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
    }

    /**
     * Returns the highest-priority category the node matches.
     *
     * @param node node to classify
     * @return category, or empty for nodes without text or without a match
     */
    public Optional<CgraComponentCategory> classify(SyntaxNode node) {
        if (!node.hasText()) {
            return Optional.empty();
        }
        for (RuleEntry<CgraComponentCategory> entry : rules.entries()) {
            if (entry.rule().matchesText(node)) {
                return Optional.of(entry.category());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the table this classifier uses.
     *
     * @return rule table
     */
    public RuleTable<CgraComponentCategory> rules() {
        return rules;
    }
}
