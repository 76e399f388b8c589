package com.archsketch.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Root configuration for ArchSketch runs.
 *
 * <p>Loaded from {@code archsketch.yaml}. Every section is optional; missing sections and
 * values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: zeonica
 *   description: CGRA simulator
 *
 * analysis:
 *   parallel: true
 *   includeOrphanComponents: false
 *
 * rules:
 *   generic:
 *     component: { identifiers: [tile], kinds: [type_spec] }
 *   cgra:
 *     memory: [Scratchpad]
 *
 * output:
 *   directory: ./arch_analysis
 *   formats: [json, markdown, mermaid]
 * }</pre>
 *
 * @param project project metadata
 * @param analysis aggregation settings
 * @param rules rule table extensions
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("analysis") AnalysisSettings analysis,
    @JsonProperty("rules") RuleOverrides rules,
    @JsonProperty("output") OutputConfig output
) {
    public static final String DEFAULT_OUTPUT_DIRECTORY = "./arch_analysis";
    public static final List<String> DEFAULT_FORMATS = List.of("json", "markdown", "mermaid");

    /**
     * Compact constructor filling missing sections with defaults.
     */
    public ProjectConfig {
        if (project == null) {
            project = new ProjectInfo(null, null);
        }
        if (analysis == null) {
            analysis = new AnalysisSettings(null, null);
        }
        if (rules == null) {
            rules = new RuleOverrides(null, null);
        }
        if (output == null) {
            output = new OutputConfig(null, null);
        }
    }

    /**
     * Creates the default configuration: sequential, orphans excluded, built-in rules,
     * all output formats.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param description optional description placed in report metadata
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
    ) {
        public ProjectInfo {
            if (name == null || name.isBlank()) {
                name = "project";
            }
        }
    }

    /**
     * Aggregation settings.
     *
     * @param parallel analyse files on a parallel stream
     * @param includeOrphanComponents list components that never take part in a relationship
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisSettings(
        @JsonProperty("parallel") Boolean parallel,
        @JsonProperty("includeOrphanComponents") Boolean includeOrphanComponents
    ) {
        public boolean isParallel() {
            return Boolean.TRUE.equals(parallel);
        }

        public boolean includesOrphans() {
            return Boolean.TRUE.equals(includeOrphanComponents);
        }
    }

    /**
     * Extra keywords and node kinds appended to the built-in rule tables.
     *
     * <p>Keys are category keys ({@code component}, {@code data_flow}, {@code memory}, ...).
     *
     * @param generic generic category key to extension
     * @param cgra CGRA category key to extra keywords
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RuleOverrides(
        @JsonProperty("generic") Map<String, GenericRuleOverride> generic,
        @JsonProperty("cgra") Map<String, List<String>> cgra
    ) {
        public RuleOverrides {
            generic = generic == null ? Map.of() : generic;
            cgra = cgra == null ? Map.of() : cgra;
        }
    }

    /**
     * Extension of one generic category.
     *
     * @param identifiers extra identifier keywords
     * @param kinds extra node kinds
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GenericRuleOverride(
        @JsonProperty("identifiers") List<String> identifiers,
        @JsonProperty("kinds") List<String> kinds
    ) {
        public GenericRuleOverride {
            identifiers = identifiers == null ? List.of() : identifiers;
            kinds = kinds == null ? List.of() : kinds;
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param formats enabled generator IDs
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("formats") List<String> formats
    ) {
        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_OUTPUT_DIRECTORY;
            }
            if (formats == null || formats.isEmpty()) {
                formats = DEFAULT_FORMATS;
            }
        }
    }
}
