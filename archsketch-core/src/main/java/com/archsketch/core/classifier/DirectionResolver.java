package com.archsketch.core.classifier;

import com.archsketch.core.model.FlowDirection;
import com.archsketch.core.model.SyntaxNode;

import java.util.List;

/**
 * Infers data-flow direction from node text.
 *
 * <p>Inbound cues are checked before outbound cues, so text carrying both (for example
 * {@code data_in_out_buffer}) resolves to {@link FlowDirection#IN}. Matching is by
 * substring on case-folded text, hence {@code "in"} also fires inside longer words.
 */
public final class DirectionResolver {

    static final List<String> INBOUND_CUES = List.of("input", "in", "receive");
    static final List<String> OUTBOUND_CUES = List.of("output", "out", "send");

    private DirectionResolver() {
        // Utility class
    }

    /**
     * Resolves the direction of a data-flow node.
     *
     * @param node matched data-flow node
     * @return IN, OUT or BIDIRECTIONAL
     */
    public static FlowDirection resolve(SyntaxNode node) {
        return resolve(node.foldedText());
    }

    /**
     * Resolves the direction of already case-folded text.
     *
     * @param foldedText lower-case text, never {@code null}
     * @return IN, OUT or BIDIRECTIONAL
     */
    public static FlowDirection resolve(String foldedText) {
        if (containsAny(foldedText, INBOUND_CUES)) {
            return FlowDirection.IN;
        }
        if (containsAny(foldedText, OUTBOUND_CUES)) {
            return FlowDirection.OUT;
        }
        return FlowDirection.BIDIRECTIONAL;
    }

    private static boolean containsAny(String text, List<String> cues) {
        for (String cue : cues) {
            if (text.contains(cue)) {
                return true;
            }
        }
        return false;
    }
}
