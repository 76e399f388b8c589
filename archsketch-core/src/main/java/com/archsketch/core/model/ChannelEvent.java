package com.archsketch.core.model;

import java.util.Objects;

/**
 * A send or receive construct found in a syntax tree.
 *
 * @param kind send or receive
 * @param span location of the statement
 */
public record ChannelEvent(ChannelEventKind kind, Span span) {

    public ChannelEvent {
        Objects.requireNonNull(kind, "kind must not be null");
        if (span == null) {
            span = Span.EMPTY;
        }
    }
}
