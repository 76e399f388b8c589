package com.archsketch.core.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered table of category → rule entries.
 *
 * <p>The order of entries is part of the contract: classifiers that pick a single
 * category (the CGRA classifier) test entries front to back and stop at the first match.
 * Tables are immutable; {@link #extend} returns a new table with the same order.
 *
 * @param <C> category enum
 */
public final class RuleTable<C extends Enum<C>> {

    private final Class<C> categoryType;
    private final List<RuleEntry<C>> entries;
    private final Map<C, PatternRule> index;

    private RuleTable(Class<C> categoryType, List<RuleEntry<C>> entries) {
        this.categoryType = categoryType;
        this.entries = List.copyOf(entries);
        Map<C, PatternRule> byCategory = new EnumMap<>(categoryType);
        for (RuleEntry<C> entry : this.entries) {
            if (byCategory.putIfAbsent(entry.category(), entry.rule()) != null) {
                throw new IllegalArgumentException("Duplicate rule for category " + entry.category());
            }
        }
        this.index = Collections.unmodifiableMap(byCategory);
    }

    /**
     * Creates a table from entries in priority order.
     *
     * @param categoryType category enum class
     * @param entries entries, first entry has the highest priority
     * @param <C> category type
     * @return rule table
     * @throws IllegalArgumentException if a category appears twice
     */
    public static <C extends Enum<C>> RuleTable<C> of(Class<C> categoryType, List<RuleEntry<C>> entries) {
        Objects.requireNonNull(categoryType, "categoryType must not be null");
        Objects.requireNonNull(entries, "entries must not be null");
        return new RuleTable<>(categoryType, entries);
    }

    /**
     * Returns the entries in priority order.
     *
     * @return immutable entry list
     */
    public List<RuleEntry<C>> entries() {
        return entries;
    }

    /**
     * Returns the rule of a category.
     *
     * @param category category to look up
     * @return rule, or an empty rule if the table has no entry for the category
     */
    public PatternRule ruleFor(C category) {
        PatternRule rule = index.get(category);
        return rule != null ? rule : new PatternRule(null, null);
    }

    /**
     * Returns the enum class of the categories.
     *
     * @return category type
     */
    public Class<C> categoryType() {
        return categoryType;
    }

    /**
     * Returns a table whose rule for {@code category} has extra keywords and kinds.
     *
     * <p>A category missing from the table is appended at the lowest priority.
     *
     * @param category category to extend
     * @param extraKeywords keywords to add
     * @param extraKinds node kinds to add
     * @return new table
     */
    public RuleTable<C> extend(C category, Iterable<String> extraKeywords, Iterable<String> extraKinds) {
        List<RuleEntry<C>> updated = new ArrayList<>(entries.size() + 1);
        boolean found = false;
        for (RuleEntry<C> entry : entries) {
            if (entry.category() == category) {
                updated.add(new RuleEntry<>(category, entry.rule().extendedWith(extraKeywords, extraKinds)));
                found = true;
            } else {
                updated.add(entry);
            }
        }
        if (!found) {
            updated.add(new RuleEntry<>(category, new PatternRule(null, null).extendedWith(extraKeywords, extraKinds)));
        }
        return new RuleTable<>(categoryType, updated);
    }

    @Override
    public String toString() {
        return "RuleTable" + entries;
    }
}
