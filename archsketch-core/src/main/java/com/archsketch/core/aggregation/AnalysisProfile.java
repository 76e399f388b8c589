package com.archsketch.core.aggregation;

import com.archsketch.core.model.FileBuckets;
import com.archsketch.core.model.FileFailure;

import java.util.List;

/**
 * Pluggable per-file analysis folded project-wide by the {@link AggregationEngine}.
 *
 * <p>Partial results must be immutable and {@link #merge} must be associative with
 * {@link #emptyPartial()} as identity. The engine only calls {@link #analyze} concurrently;
 * merging and finishing happen on a single thread in canonical file order.
 *
 * @param <P> per-file partial result
 * @param <R> final analysis
 */
public interface AnalysisProfile<P, R> {

    /**
     * Returns the identifier of this profile, e.g. {@code generic} or {@code cgra}.
     *
     * @return profile identifier
     */
    String getId();

    /**
     * Returns the identity element of {@link #merge}.
     *
     * @return empty partial result
     */
    P emptyPartial();

    /**
     * Analyses one parsed file.
     *
     * <p>Any exception marks the file as failed without aborting the batch.
     *
     * @param file file with a parsed tree
     * @return partial result for the file
     */
    P analyze(SourceFile file);

    /**
     * Concatenates two partial results, {@code left} first.
     *
     * @param left earlier partial
     * @param right later partial
     * @return combined partial
     */
    P merge(P left, P right);

    /**
     * Folds partial results in list order.
     *
     * <p>Equivalent to folding {@link #merge} from {@link #emptyPartial}; profiles with
     * list-backed partials override it to build the total in one pass.
     *
     * @param partials partials in canonical file order
     * @return combined partial
     */
    default P mergeAll(List<P> partials) {
        P total = emptyPartial();
        for (P partial : partials) {
            total = merge(total, partial);
        }
        return total;
    }

    /**
     * Builds the final analysis from the folded partial.
     *
     * @param total fold of all successful files
     * @param buckets successful files grouped by role
     * @param failures skipped files
     * @return final analysis
     */
    R finish(P total, FileBuckets buckets, List<FileFailure> failures);
}
