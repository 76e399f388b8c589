package com.archsketch.core.extractor;

import com.archsketch.core.model.SyntaxNode;

import java.util.List;

/**
 * Single-purpose pass over one syntax tree.
 *
 * <p>Each extractor walks the whole tree on its own and shares no state with other
 * extractors, so a node may show up in the output of several of them. Extractors are
 * stateless apart from their rule tables and safe to share between threads.
 *
 * <p>Analysis profiles ({@link com.archsketch.core.aggregation.AnalysisProfile}) combine
 * extractors per file; the aggregation engine folds their output project-wide.
 *
 * @param <T> type of record produced
 */
public interface TreeExtractor<T> {

    /**
     * Returns the unique identifier of this extractor.
     *
     * <p>Kebab-case, e.g. {@code control-flow} or {@code cgra-components}.
     *
     * @return extractor identifier
     */
    String getId();

    /**
     * Returns a human-readable name used in logs and CLI output.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Extracts records from a tree.
     *
     * <p>Must not throw on malformed nodes: missing text or children are treated as empty.
     *
     * @param root root of the tree
     * @return records in pre-order of the nodes that produced them, never {@code null}
     */
    List<T> extract(SyntaxNode root);
}
