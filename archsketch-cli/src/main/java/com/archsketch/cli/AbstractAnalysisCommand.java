package com.archsketch.cli;

import com.archsketch.core.aggregation.AggregationEngine;
import com.archsketch.core.aggregation.SourceFile;
import com.archsketch.core.config.ConfigLoader;
import com.archsketch.core.config.ProjectConfig;
import com.archsketch.core.generator.GeneratedReport;
import com.archsketch.core.generator.GeneratorConfig;
import com.archsketch.core.generator.ReportGenerator;
import com.archsketch.core.io.BundleLoader;
import com.archsketch.core.model.AnalysisDocument;
import com.archsketch.core.model.FileFailure;
import com.archsketch.core.renderer.GeneratedOutput;
import com.archsketch.core.renderer.OutputRenderer;
import com.archsketch.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Shared pipeline of the analysis commands.
 *
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Load syntax-tree bundles</li>
 *   <li>Aggregate with the command's profile</li>
 *   <li>Generate the configured report formats</li>
 *   <li>Render to the output directory and, optionally, the console</li>
 * </ol>
 */
public abstract class AbstractAnalysisCommand implements Callable<Integer> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Parameters(
        index = "0",
        description = "Bundle file or directory of bundle files"
    )
    protected Path input;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: archsketch.yaml)"
    )
    protected Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    protected Path outputDir;

    @Option(
        names = {"--parallel"},
        negatable = true,
        description = "Analyse files in parallel; --no-parallel forces sequential (overrides config)"
    )
    protected Boolean parallel;

    @Option(
        names = {"--format"},
        description = "Output format: json, markdown or mermaid (repeatable, overrides config)"
    )
    protected List<String> formats;

    @Option(
        names = {"--console"},
        description = "Also print generated reports to the console"
    )
    protected boolean console;

    /**
     * Runs the command's profile over the loaded files.
     *
     * @param config effective configuration
     * @param files loaded source files
     * @param engine aggregation engine
     * @return assembled document
     */
    protected abstract AnalysisDocument analyze(ProjectConfig config, List<SourceFile> files, AggregationEngine engine);

    /**
     * Returns the base name of generated files.
     *
     * @return file base name
     */
    protected abstract String reportBaseName();

    /**
     * Returns a short label used in CLI output.
     *
     * @return label, e.g. {@code Architecture}
     */
    protected abstract String label();

    @Override
    public Integer call() {
        try {
            log.info("Starting {} analysis of: {}", label().toLowerCase(), input.toAbsolutePath());
            System.out.println("Analysing: " + input.toAbsolutePath());

            ProjectConfig config = ConfigLoader.load(configPath);

            List<SourceFile> files = new BundleLoader().load(input);
            System.out.println("✓ Loaded " + files.size() + " file(s)");

            AggregationEngine engine = new AggregationEngine(resolveParallel(config));
            AnalysisDocument document = analyze(config, files, engine);
            printSummary(document);

            List<GeneratedReport> reports = generateReports(document, config);
            System.out.println("✓ Generated " + reports.size() + " report(s)");

            renderReports(reports, config);
            System.out.println("✓ " + label() + " analysis complete: " + resolveOutputDirectory(config));
            return 0;
        } catch (Exception e) {
            log.error("{} analysis failed", label(), e);
            System.err.println("✗ " + label() + " analysis failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Parallel mode in effect: the command-line flag when given, else the configured setting.
     *
     * @param config effective configuration
     * @return whether files are analysed in parallel
     */
    boolean resolveParallel(ProjectConfig config) {
        return parallel != null ? parallel : config.analysis().isParallel();
    }

    /**
     * Description placed in report metadata.
     *
     * @param config effective configuration
     * @param fallback description used when the project has none
     * @return description
     */
    protected String description(ProjectConfig config, String fallback) {
        String description = config.project().description();
        return description == null || description.isBlank() ? fallback : description;
    }

    private void printSummary(AnalysisDocument document) {
        System.out.println();
        System.out.println(label() + " Summary:");
        document.metadata().summary().forEach((key, value) ->
            System.out.printf("  %-22s %s%n", key + ":", value));
        List<FileFailure> diagnostics = document.diagnostics();
        if (!diagnostics.isEmpty()) {
            System.out.println("  Skipped files:");
            diagnostics.forEach(failure -> System.out.println("    - " + failure.file() + ": " + failure.reason()));
        }
        System.out.println();
    }

    private List<GeneratedReport> generateReports(AnalysisDocument document, ProjectConfig config) {
        Map<String, ReportGenerator> available = new LinkedHashMap<>();
        ServiceLoader.load(ReportGenerator.class).forEach(g -> available.put(g.getId(), g));
        log.debug("Discovered report generators: {}", available.keySet());

        List<String> requested = formats != null && !formats.isEmpty() ? formats : config.output().formats();
        GeneratorConfig generatorConfig = GeneratorConfig.named(reportBaseName());

        List<GeneratedReport> reports = new ArrayList<>();
        for (String format : requested) {
            ReportGenerator generator = available.get(format.trim().toLowerCase());
            if (generator == null) {
                log.warn("Unknown output format '{}'. Available: {}", format, available.keySet());
                continue;
            }
            log.debug("Running generator: {} ({})", generator.getDisplayName(), generator.getId());
            reports.add(generator.generate(document, generatorConfig));
        }
        return reports;
    }

    private void renderReports(List<GeneratedReport> reports, ProjectConfig config) {
        Map<String, OutputRenderer> renderers = new LinkedHashMap<>();
        ServiceLoader.load(OutputRenderer.class).forEach(r -> renderers.put(r.getId(), r));

        GeneratedOutput output = GeneratedOutput.of(reports);
        RenderContext context = new RenderContext(resolveOutputDirectory(config), Map.of());

        OutputRenderer fileSystem = renderers.get("filesystem");
        if (fileSystem == null) {
            throw new IllegalStateException("Filesystem renderer not found");
        }
        fileSystem.render(output, context);

        if (console) {
            OutputRenderer consoleRenderer = renderers.get("console");
            if (consoleRenderer == null) {
                throw new IllegalStateException("Console renderer not found");
            }
            consoleRenderer.render(output, context);
        }
    }

    private String resolveOutputDirectory(ProjectConfig config) {
        Path directory = outputDir != null ? outputDir : Paths.get(config.output().directory());
        return directory.toAbsolutePath().normalize().toString();
    }
}
