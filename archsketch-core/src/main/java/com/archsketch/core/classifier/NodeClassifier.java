package com.archsketch.core.classifier;

import com.archsketch.core.model.PatternCategory;
import com.archsketch.core.model.SyntaxNode;
import com.archsketch.core.rules.DefaultRuleTables;
import com.archsketch.core.rules.PatternRule;
import com.archsketch.core.rules.RuleTable;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Generic, non-exclusive node classifier.
 *
 * <p>A node matches a category when its kind is one of the category's node kinds, or when
 * its case-folded text contains one of the category's identifier keywords. Nodes without
 * text can only match by kind. Classification is a pure function of the node and the table.
 */
public class NodeClassifier {

    private final RuleTable<PatternCategory> rules;

    /**
     * Creates a classifier backed by the built-in generic table.
     */
    public NodeClassifier() {
        this(DefaultRuleTables.generic());
    }

    /**
     * Creates a classifier backed by the given table.
     *
     * @param rules generic rule table
     */
    public NodeClassifier(RuleTable<PatternCategory> rules) {
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
    }

    /**
     * Returns true if the node matches the category.
     *
     * @param node node to classify
     * @param category category to test
     * @return true on a kind or keyword match
     */
    public boolean classify(SyntaxNode node, PatternCategory category) {
        PatternRule rule = rules.ruleFor(category);
        return rule.matchesKind(node) || rule.matchesText(node);
    }

    /**
     * Returns every category the node matches.
     *
     * @param node node to classify
     * @return matching categories, possibly empty
     */
    public Set<PatternCategory> categoriesOf(SyntaxNode node) {
        Set<PatternCategory> matched = EnumSet.noneOf(PatternCategory.class);
        for (PatternCategory category : PatternCategory.values()) {
            if (classify(node, category)) {
                matched.add(category);
            }
        }
        return matched;
    }

    /**
     * Returns the table this classifier uses.
     *
     * @return rule table
     */
    public RuleTable<PatternCategory> rules() {
        return rules;
    }
}
