package com.virusbot.model;

/**
 * Neighbour relation used by a board. Every adjacency question on a board
 * (neighbours, move generation, evaluator checks) goes through the same relation.
 */
public enum Adjacency {

    /** Up, down, left and right. */
    ORTHOGONAL(new int[][]{{-1, 0}, {1, 0}, {0, -1}, {0, 1}}),

    /** Orthogonal plus the four diagonals. */
    MOORE(new int[][]{{-1, 0}, {1, 0}, {0, -1}, {0, 1}, {-1, -1}, {-1, 1}, {1, -1}, {1, 1}});

    private final int[][] offsets;

    Adjacency(int[][] offsets) {
        this.offsets = offsets;
    }

    int[][] offsets() {
        return offsets;
    }

    public int maxNeighbors() {
        return offsets.length;
    }

    public boolean isAdjacent(Position a, Position b) {
        int dr = Math.abs(a.row() - b.row());
        int dc = Math.abs(a.col() - b.col());
        if (dr == 0 && dc == 0) {
            return false;
        }
        return switch (this) {
            case ORTHOGONAL -> dr + dc == 1;
            case MOORE -> dr <= 1 && dc <= 1;
        };
    }
}
