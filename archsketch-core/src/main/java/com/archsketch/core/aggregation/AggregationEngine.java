package com.archsketch.core.aggregation;

import com.archsketch.core.model.FileFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs an {@link AnalysisProfile} over a batch of files.
 *
 * <p>Files are sorted into canonical order, analysed independently (optionally on a
 * parallel stream) and folded by a single writer in canonical order. Output therefore
 * depends only on the set of files, never on scheduling.
 *
 * <p>Files without a tree and files whose analysis throws are recorded as
 * {@link FileFailure}s; the batch always completes.
 */
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final boolean parallel;

    public AggregationEngine() {
        this(false);
    }

    public AggregationEngine(boolean parallel) {
        this.parallel = parallel;
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * Analyses a batch of files.
     *
     * @param profile analysis to run
     * @param files input files in any order
     * @param <P> partial result type
     * @param <R> final analysis type
     * @return final analysis
     */
    public <P, R> R run(AnalysisProfile<P, R> profile, Collection<SourceFile> files) {
        List<SourceFile> ordered = new ArrayList<>(files);
        ordered.sort(SourceFile.CANONICAL_ORDER);
        log.info("Analysing {} file(s) with profile '{}' ({})",
            ordered.size(), profile.getId(), parallel ? "parallel" : "sequential");

        Stream<SourceFile> stream = parallel ? ordered.parallelStream() : ordered.stream();
        List<FileOutcome<P>> outcomes = stream
            .map(file -> analyzeOne(profile, file))
            .collect(Collectors.toList());

        List<P> partials = new ArrayList<>();
        List<SourceFile> analysed = new ArrayList<>();
        List<FileFailure> failures = new ArrayList<>();
        for (FileOutcome<P> outcome : outcomes) {
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
            } else {
                partials.add(outcome.partial());
                analysed.add(outcome.file());
            }
        }
        P total = profile.mergeAll(partials);

        if (!failures.isEmpty()) {
            log.warn("{} of {} file(s) were skipped", failures.size(), ordered.size());
        }
        log.info("Profile '{}' folded {} file(s)", profile.getId(), analysed.size());

        return profile.finish(total, FileBucketClassifier.bucket(analysed), failures);
    }

    private static <P> FileOutcome<P> analyzeOne(AnalysisProfile<P, ?> profile, SourceFile file) {
        if (!file.isParsed()) {
            log.warn("Skipping {}: {}", file.relativePath(), file.loadError());
            return FileOutcome.failed(file, file.loadError());
        }
        try {
            log.debug("Analysing {} ({})", file.relativePath(), file.component());
            return new FileOutcome<>(file, profile.analyze(file), null);
        } catch (RuntimeException e) {
            log.warn("Failed to analyse {}: {}", file.relativePath(), e.getMessage());
            log.debug("Analysis failure details", e);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return FileOutcome.failed(file, reason);
        }
    }

    private record FileOutcome<P>(SourceFile file, P partial, FileFailure failure) {

        static <P> FileOutcome<P> failed(SourceFile file, String reason) {
            return new FileOutcome<>(file, null, new FileFailure(file.component(), file.relativePath(), reason));
        }
    }
}
