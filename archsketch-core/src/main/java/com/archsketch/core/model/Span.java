package com.archsketch.core.model;

/**
 * Source range covered by a syntax node.
 *
 * @param start first position of the node
 * @param end position just past the node
 */
public record Span(Position start, Position end) {

    /** Span used for nodes whose location is unknown. */
    public static final Span EMPTY = new Span(Position.ORIGIN, Position.ORIGIN);

    /**
     * Compact constructor with validation.
     */
    public Span {
        if (start == null) {
            start = Position.ORIGIN;
        }
        if (end == null) {
            end = start;
        }
    }

    /**
     * Creates a span from raw row/column pairs.
     *
     * @param startRow start row
     * @param startColumn start column
     * @param endRow end row
     * @param endColumn end column
     * @return span
     */
    public static Span of(int startRow, int startColumn, int endRow, int endColumn) {
        return new Span(new Position(startRow, startColumn), new Position(endRow, endColumn));
    }
}
