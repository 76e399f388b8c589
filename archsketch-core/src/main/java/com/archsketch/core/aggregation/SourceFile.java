package com.archsketch.core.aggregation;

import com.archsketch.core.model.SyntaxNode;

import java.util.Comparator;
import java.util.Objects;

/**
 * One input file of an analysis batch.
 *
 * <p>Either carries a parsed tree or the reason it could not be loaded.
 *
 * @param component component (top-level directory) the file belongs to
 * @param relativePath path relative to the project root, {@code /}-separated
 * @param tree parsed syntax tree, {@code null} when loading failed
 * @param loadError reason the tree is missing, {@code null} when parsed
 */
public record SourceFile(
    String component,
    String relativePath,
    SyntaxNode tree,
    String loadError
) {
    /**
     * Canonical batch order: component, then relative path.
     */
    public static final Comparator<SourceFile> CANONICAL_ORDER =
        Comparator.comparing(SourceFile::component).thenComparing(SourceFile::relativePath);

    /**
     * Compact constructor with validation.
     */
    public SourceFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        relativePath = relativePath.replace('\\', '/');
        if (component == null || component.isBlank()) {
            component = firstSegment(relativePath);
        }
        if (tree == null && loadError == null) {
            loadError = "no syntax tree";
        }
    }

    public static SourceFile parsed(String component, String relativePath, SyntaxNode tree) {
        return new SourceFile(component, relativePath, Objects.requireNonNull(tree, "tree must not be null"), null);
    }

    public static SourceFile failed(String component, String relativePath, String loadError) {
        return new SourceFile(component, relativePath, null, loadError);
    }

    public boolean isParsed() {
        return tree != null;
    }

    /**
     * Returns the last path segment.
     *
     * @return file name
     */
    public String fileName() {
        int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? relativePath : relativePath.substring(slash + 1);
    }

    private static String firstSegment(String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        int slash = trimmed.indexOf('/');
        return slash < 0 ? "" : trimmed.substring(0, slash);
    }
}
