package com.archsketch.core.aggregation;

import com.archsketch.core.model.FileBucket;
import com.archsketch.core.model.FileBuckets;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Groups files by their role in the project, first matching rule wins.
 *
 * <ol>
 *   <li>file name contains {@code test}: tests</li>
 *   <li>relative path contains {@code samples}: samples</li>
 *   <li>lower-cased relative path contains {@code core}, {@code cgra} or {@code pe}: core components</li>
 *   <li>otherwise: utilities</li>
 * </ol>
 */
public final class FileBucketClassifier {

    private static final List<String> CORE_MARKERS = List.of("core", "cgra", "pe");

    private FileBucketClassifier() {
        // Utility class
    }

    public static FileBucket classify(SourceFile file) {
        if (file.fileName().contains("test")) {
            return FileBucket.TESTS;
        }
        if (file.relativePath().contains("samples")) {
            return FileBucket.SAMPLES;
        }
        String lowered = file.relativePath().toLowerCase(Locale.ROOT);
        if (CORE_MARKERS.stream().anyMatch(lowered::contains)) {
            return FileBucket.CORE_COMPONENTS;
        }
        return FileBucket.UTILITIES;
    }

    /**
     * Buckets files, keeping their order inside each bucket.
     *
     * @param files files to bucket
     * @return bucketed relative paths
     */
    public static FileBuckets bucket(List<SourceFile> files) {
        Map<FileBucket, List<String>> buckets = new EnumMap<>(FileBucket.class);
        for (FileBucket bucket : FileBucket.values()) {
            buckets.put(bucket, new ArrayList<>());
        }
        for (SourceFile file : files) {
            buckets.get(classify(file)).add(file.relativePath());
        }
        return new FileBuckets(
            buckets.get(FileBucket.TESTS),
            buckets.get(FileBucket.SAMPLES),
            buckets.get(FileBucket.CORE_COMPONENTS),
            buckets.get(FileBucket.UTILITIES)
        );
    }
}
