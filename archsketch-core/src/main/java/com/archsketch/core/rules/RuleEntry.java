package com.archsketch.core.rules;

import java.util.Objects;

/**
 * One row of a {@link RuleTable}.
 *
 * @param category category the rule belongs to
 * @param rule matching rule
 * @param <C> category type
 */
public record RuleEntry<C extends Enum<C>>(C category, PatternRule rule) {

    public RuleEntry {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(rule, "rule must not be null");
    }
}
