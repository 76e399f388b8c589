package com.archsketch.core.renderer;

/**
 * Writes generated reports to a destination.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}.
 */
public interface OutputRenderer {

    /**
     * Returns the unique identifier of this renderer, e.g. {@code filesystem} or {@code console}.
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Renders all files of the output.
     *
     * @param output files to render
     * @param context destination and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
