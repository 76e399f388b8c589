package com.archsketch.core.generator;

import java.util.Map;

/**
 * Settings shared by all generators.
 *
 * @param baseName base file name of generated reports, e.g. {@code architecture_analysis}
 * @param topComponents number of components listed in summaries
 * @param customSettings generator-specific settings
 */
public record GeneratorConfig(
    String baseName,
    int topComponents,
    Map<String, Object> customSettings
) {
    public static final int DEFAULT_TOP_COMPONENTS = 10;

    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (baseName == null || baseName.isBlank()) {
            baseName = "architecture_analysis";
        }
        if (topComponents <= 0) {
            topComponents = DEFAULT_TOP_COMPONENTS;
        }
        if (customSettings == null) {
            customSettings = Map.of();
        }
    }

    public static GeneratorConfig defaults() {
        return new GeneratorConfig(null, DEFAULT_TOP_COMPONENTS, Map.of());
    }

    public static GeneratorConfig named(String baseName) {
        return new GeneratorConfig(baseName, DEFAULT_TOP_COMPONENTS, Map.of());
    }

    /**
     * Returns a generator-specific setting.
     *
     * @param key setting key
     * @param defaultValue value returned when the key is absent
     * @param <T> setting type
     * @return setting value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }
}
