package com.virusbot.model;

/**
 * A cell coordinate on the board.
 *
 * @param row zero-based row
 * @param col zero-based column
 */
public record Position(int row, int col) {

    public static Position of(int row, int col) {
        return new Position(row, col);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}
