package com.archsketch.core.rules;

import com.archsketch.core.model.SyntaxNode;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Matching rule of one category: identifier keywords and node kinds.
 *
 * <p>Keywords are stored lower-cased and matched as substrings of the case-folded node
 * text. Node kinds are matched exactly. Both sets keep declaration order so tables print
 * the way they were written.
 *
 * @param identifierKeywords keywords searched in node text
 * @param nodeKinds node kinds that match outright
 */
public record PatternRule(
    Set<String> identifierKeywords,
    Set<String> nodeKinds
) {
    /**
     * Compact constructor with validation.
     */
    public PatternRule {
        Set<String> keywords = new LinkedHashSet<>();
        if (identifierKeywords != null) {
            for (String keyword : identifierKeywords) {
                if (keyword != null && !keyword.isBlank()) {
                    keywords.add(keyword.toLowerCase(Locale.ROOT));
                }
            }
        }
        identifierKeywords = Collections.unmodifiableSet(keywords);

        Set<String> kinds = new LinkedHashSet<>();
        if (nodeKinds != null) {
            for (String kind : nodeKinds) {
                if (kind != null && !kind.isBlank()) {
                    kinds.add(kind);
                }
            }
        }
        nodeKinds = Collections.unmodifiableSet(kinds);
    }

    /**
     * Creates a rule that only matches on keywords.
     *
     * @param keywords identifier keywords
     * @return keyword-only rule
     */
    public static PatternRule keywords(String... keywords) {
        return new PatternRule(new LinkedHashSet<>(Arrays.asList(keywords)), Set.of());
    }

    /**
     * Returns true if the node kind is listed by this rule.
     *
     * @param node node to test
     * @return true on an exact kind match
     */
    public boolean matchesKind(SyntaxNode node) {
        return nodeKinds.contains(node.kind());
    }

    /**
     * Returns true if the case-folded node text contains any keyword.
     *
     * <p>Nodes without text never match.
     *
     * @param node node to test
     * @return true on a keyword hit
     */
    public boolean matchesText(SyntaxNode node) {
        if (!node.hasText()) {
            return false;
        }
        String folded = node.foldedText();
        for (String keyword : identifierKeywords) {
            if (folded.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a rule with additional keywords and kinds appended.
     *
     * @param extraKeywords keywords to append, may be {@code null}
     * @param extraKinds kinds to append, may be {@code null}
     * @return extended rule
     */
    public PatternRule extendedWith(Iterable<String> extraKeywords, Iterable<String> extraKinds) {
        Set<String> keywords = new LinkedHashSet<>(identifierKeywords);
        if (extraKeywords != null) {
            extraKeywords.forEach(keywords::add);
        }
        Set<String> kinds = new LinkedHashSet<>(nodeKinds);
        if (extraKinds != null) {
            extraKinds.forEach(kinds::add);
        }
        return new PatternRule(keywords, kinds);
    }
}
