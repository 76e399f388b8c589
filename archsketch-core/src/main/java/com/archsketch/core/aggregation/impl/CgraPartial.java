package com.archsketch.core.aggregation.impl;

import com.archsketch.core.model.CgraComponent;
import com.archsketch.core.model.ChannelEvent;
import com.archsketch.core.model.Relationship;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-file result of the CGRA project profile.
 *
 * @param components classified components in tree order
 * @param relationships containment relationships
 * @param channelEvents send and receive statements in tree order
 */
public record CgraPartial(
    List<CgraComponent> components,
    List<Relationship> relationships,
    List<ChannelEvent> channelEvents
) {
    private static final CgraPartial EMPTY = new CgraPartial(List.of(), List.of(), List.of());

    /**
     * Compact constructor with validation.
     */
    public CgraPartial {
        components = components == null ? List.of() : List.copyOf(components);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        channelEvents = channelEvents == null ? List.of() : List.copyOf(channelEvents);
    }

    public static CgraPartial empty() {
        return EMPTY;
    }

    public CgraPartial concat(CgraPartial other) {
        return new CgraPartial(
            GenericPartial.join(components, other.components),
            GenericPartial.join(relationships, other.relationships),
            GenericPartial.join(channelEvents, other.channelEvents)
        );
    }

    /**
     * Concatenates partials in list order, copying each record once.
     *
     * @param partials partials in fold order
     * @return concatenation of all partials
     */
    public static CgraPartial concatAll(List<CgraPartial> partials) {
        List<CgraComponent> components = new ArrayList<>();
        List<Relationship> relationships = new ArrayList<>();
        List<ChannelEvent> channelEvents = new ArrayList<>();
        for (CgraPartial partial : partials) {
            components.addAll(partial.components);
            relationships.addAll(partial.relationships);
            channelEvents.addAll(partial.channelEvents);
        }
        return new CgraPartial(components, relationships, channelEvents);
    }
}
