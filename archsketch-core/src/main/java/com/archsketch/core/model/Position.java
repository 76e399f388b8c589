package com.archsketch.core.model;

/**
 * Zero-based row/column location inside a source file.
 *
 * @param row zero-based line index
 * @param column zero-based column index
 */
public record Position(int row, int column) {

    /** Origin of a file, also used when a node carries no location. */
    public static final Position ORIGIN = new Position(0, 0);

    /**
     * Compact constructor with validation.
     */
    public Position {
        if (row < 0) {
            row = 0;
        }
        if (column < 0) {
            column = 0;
        }
    }
}
