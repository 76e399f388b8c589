package com.archsketch.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Destination and settings for a render.
 *
 * <p>Known settings: {@code console.colors} ({@code true}/{@code false}).
 *
 * @param outputDirectory directory files are written to
 * @param settings renderer-specific settings
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        if (settings == null) {
            settings = Map.of();
        }
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
