package com.archsketch.core.renderer.impl;

import com.archsketch.core.renderer.GeneratedFile;
import com.archsketch.core.renderer.GeneratedOutput;
import com.archsketch.core.renderer.OutputRenderer;
import com.archsketch.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints generated files to a stream, stdout by default.
 *
 * <p>File headers are highlighted with ANSI colors unless {@code console.colors} is
 * {@code false}.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_CYAN = "\u001B[1m\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String SEPARATOR = "-".repeat(80);

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean colors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "true"));
        log.debug("Printing {} file(s) to console (colors: {})", output.files().size(), colors);

        int total = output.files().size();
        for (int i = 0; i < total; i++) {
            GeneratedFile file = output.files().get(i);
            out.println(paint(SEPARATOR, ANSI_YELLOW, colors));
            out.println(paint("File " + (i + 1) + "/" + total + ": " + file.relativePath(), ANSI_BOLD_CYAN, colors));
            out.println();
            out.println(file.content());
        }
        if (total > 0) {
            out.println(paint(SEPARATOR, ANSI_YELLOW, colors));
        }
        out.flush();
    }

    private static String paint(String text, String color, boolean colors) {
        return colors ? color + text + ANSI_RESET : text;
    }
}
