package com.archsketch.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads ArchSketch configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code archsketch.yaml} into {@link ProjectConfig} records.
 * If the file is missing, unreadable, empty or invalid, returns {@link ProjectConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectConfig config = ConfigLoader.load(Paths.get("archsketch.yaml"));
 * boolean parallel = config.analysis().isParallel();
 * }</pre>
 */
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "archsketch.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>Never throws: problems are logged as warnings and the defaults are returned.
     *
     * @param configPath path to {@code archsketch.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ProjectConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ProjectConfig config = YAML_MAPPER.readValue(configPath.toFile(), ProjectConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ProjectConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ProjectConfig.defaults();
        }
    }
}
