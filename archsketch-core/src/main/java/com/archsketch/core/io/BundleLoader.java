package com.archsketch.core.io;

import com.archsketch.core.aggregation.SourceFile;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads pre-parsed syntax trees grouped in bundle files.
 *
 * <p>A bundle is a JSON object:
 * <pre>{@code
 * {
 *   "component": "core",
 *   "analysis": [
 *     {"file": "core/pe.go", "ast": {"file_path": "...", "ast": { ...tree... }}},
 *     {"file": "core/router.go", "tree": { ...tree... }}
 *   ]
 * }
 * }</pre>
 * {@code files} is accepted in place of {@code analysis}, and a JSON file holding a bare
 * tree is treated as a bundle of one. Entries that cannot be read become failed
 * {@link SourceFile}s; an unreadable bundle becomes a single failed entry.
 */
public class BundleLoader {

    private static final Logger log = LoggerFactory.getLogger(BundleLoader.class);

    private final SyntaxTreeReader reader;

    public BundleLoader() {
        this(new SyntaxTreeReader());
    }

    public BundleLoader(SyntaxTreeReader reader) {
        this.reader = reader;
    }

    /**
     * Loads a bundle file, or every {@code *.json} file below a directory.
     *
     * @param input bundle file or directory
     * @return source files in bundle order
     * @throws IllegalArgumentException if the input does not exist
     * @throws IOException if the directory cannot be listed
     */
    public List<SourceFile> load(Path input) throws IOException {
        if (!Files.exists(input)) {
            throw new IllegalArgumentException("Input not found: " + input);
        }
        if (Files.isRegularFile(input)) {
            return loadBundle(input);
        }

        List<Path> bundles;
        try (Stream<Path> paths = Files.walk(input)) {
            bundles = paths
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".json"))
                .sorted()
                .collect(Collectors.toList());
        }
        log.info("Found {} bundle file(s) in {}", bundles.size(), input);

        List<SourceFile> files = new ArrayList<>();
        for (Path bundle : bundles) {
            files.addAll(loadBundle(bundle));
        }
        return files;
    }

    /**
     * Loads a single bundle file.
     *
     * @param bundle JSON bundle
     * @return source files, never empty for an unreadable bundle
     */
    public List<SourceFile> loadBundle(Path bundle) {
        String bundleName = bundle.getFileName().toString();
        JsonNode root;
        try {
            root = reader.objectMapper().readTree(bundle.toFile());
        } catch (IOException e) {
            log.warn("Failed to read bundle {}: {}", bundle, e.getMessage());
            return List.of(SourceFile.failed(baseName(bundleName), bundleName, "unreadable bundle: " + e.getMessage()));
        }
        if (root == null || !root.isObject()) {
            log.warn("Bundle {} is not a JSON object", bundle);
            return List.of(SourceFile.failed(baseName(bundleName), bundleName, "bundle is not a JSON object"));
        }

        JsonNode entries = root.has("analysis") ? root.get("analysis") : root.get("files");
        if (entries == null && (root.has("kind") || root.has("type"))) {
            log.debug("Bundle {} holds a bare tree", bundle);
            return List.of(SourceFile.parsed(baseName(bundleName), bundleName, reader.toSyntaxNode(root)));
        }
        if (entries == null || !entries.isArray()) {
            log.warn("Bundle {} has no 'analysis' or 'files' array", bundle);
            return List.of(SourceFile.failed(baseName(bundleName), bundleName, "bundle has no file entries"));
        }

        String component = root.hasNonNull("component") ? root.get("component").asText() : null;
        List<SourceFile> files = new ArrayList<>();
        int index = 0;
        for (JsonNode entry : entries) {
            files.add(toSourceFile(component, bundleName, index++, entry));
        }
        log.debug("Loaded {} file entr(ies) from {}", files.size(), bundle);
        return files;
    }

    private SourceFile toSourceFile(String component, String bundleName, int index, JsonNode entry) {
        String file = entry.hasNonNull("file") ? entry.get("file").asText() : null;
        if (file == null || file.isBlank()) {
            return SourceFile.failed(component, bundleName + "#" + index, "entry has no file name");
        }

        JsonNode tree = entry.has("tree") ? entry.get("tree") : entry.get("ast");
        if (tree != null && tree.isObject() && tree.has("ast") && !tree.has("kind") && !tree.has("type")) {
            tree = tree.get("ast");
        }
        if (tree == null || !tree.isObject()) {
            return SourceFile.failed(component, file, "no syntax tree");
        }

        try {
            return SourceFile.parsed(component, file, reader.toSyntaxNode(tree));
        } catch (RuntimeException e) {
            log.warn("Failed to convert tree of {}: {}", file, e.getMessage());
            return SourceFile.failed(component, file, e.getMessage());
        }
    }

    private static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? fileName : fileName.substring(0, dot);
    }
}
