package com.archsketch.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Channel operations recognised by the dataflow channel detector.
 */
public enum ChannelEventKind {
    SEND("send_statement"),
    RECEIVE("receive_statement");

    private final String nodeKind;

    ChannelEventKind(String nodeKind) {
        this.nodeKind = nodeKind;
    }

    /**
     * Returns the syntax node kind that signals this event.
     *
     * @return node kind
     */
    public String nodeKind() {
        return nodeKind;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase();
    }

    /**
     * Maps a node kind to an event kind.
     *
     * @param kind syntax node kind
     * @return event kind, or {@code null} if the node is not a channel operation
     */
    public static ChannelEventKind forNodeKind(String kind) {
        for (ChannelEventKind eventKind : values()) {
            if (eventKind.nodeKind.equals(kind)) {
                return eventKind;
            }
        }
        return null;
    }
}
