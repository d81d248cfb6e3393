package com.virusbot.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Square game board: a dense row-major grid of {@link CellState} plus each player's base.
 * <p>
 * Every query is total over integer coordinates: out-of-bounds positions answer
 * {@code false}, an empty collection or {@link CellState#empty()} instead of throwing.
 * A board is mutable only through {@link #setCell} and {@link #setBase}; search code
 * works on {@link #copy()} or on the new boards returned by {@link #apply}.
 */
public final class Board {

    private final int size;
    private final Adjacency adjacency;
    private final CellState[] cells;
    private final Map<Integer, Position> bases;

    public Board(int size) {
        this(size, Adjacency.MOORE);
    }

    public Board(int size, Adjacency adjacency) {
        if (size <= 0) {
            throw new IllegalArgumentException("Board size must be positive: " + size);
        }
        if (adjacency == null) {
            throw new IllegalArgumentException("Adjacency is required");
        }
        this.size = size;
        this.adjacency = adjacency;
        this.cells = new CellState[size * size];
        Arrays.fill(cells, CellState.empty());
        this.bases = new HashMap<>();
    }

    private Board(Board other) {
        this.size = other.size;
        this.adjacency = other.adjacency;
        this.cells = other.cells.clone();
        this.bases = new HashMap<>(other.bases);
    }

    /**
     * Builds a board from the packed cell matrix the server sends.
     *
     * @throws IllegalArgumentException if the matrix is not square or holds an invalid value
     */
    public static Board fromPacked(int[][] packed, Map<Integer, Position> bases, Adjacency adjacency) {
        if (packed == null || packed.length == 0) {
            throw new IllegalArgumentException("Board matrix is empty");
        }
        Board board = new Board(packed.length, adjacency);
        for (int row = 0; row < packed.length; row++) {
            if (packed[row] == null || packed[row].length != packed.length) {
                throw new IllegalArgumentException("Board matrix is not square at row " + row);
            }
            for (int col = 0; col < packed.length; col++) {
                board.cells[row * board.size + col] = CellState.decode(packed[row][col]);
            }
        }
        if (bases != null) {
            board.bases.putAll(bases);
        }
        return board;
    }

    public int[][] toPacked() {
        int[][] packed = new int[size][size];
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                packed[row][col] = cells[row * size + col].encode();
            }
        }
        return packed;
    }

    public Board copy() {
        return new Board(this);
    }

    public int getSize() {
        return size;
    }

    public Adjacency getAdjacency() {
        return adjacency;
    }

    // ── cells ───────────────────────────────────────────────────────────

    public boolean isValid(Position pos) {
        return pos != null && pos.row() >= 0 && pos.row() < size && pos.col() >= 0 && pos.col() < size;
    }

    public CellState cellAt(Position pos) {
        if (!isValid(pos)) {
            return CellState.empty();
        }
        return cells[index(pos)];
    }

    /**
     * Overwrites a cell. Out-of-bounds positions are ignored.
     */
    public void setCell(Position pos, CellState state) {
        if (isValid(pos) && state != null) {
            cells[index(pos)] = state;
        }
    }

    public boolean isEmpty(Position pos) {
        return isValid(pos) && cells[index(pos)].isEmpty();
    }

    public boolean isNeutral(Position pos) {
        return isValid(pos) && cells[index(pos)].isNeutral();
    }

    public boolean isOwnedBy(Position pos, int playerId) {
        return isValid(pos) && cells[index(pos)].isOwnedBy(playerId);
    }

    public boolean isAttackableBy(Position pos, int playerId) {
        return isValid(pos) && cells[index(pos)].isAttackableBy(playerId);
    }

    // ── bases ───────────────────────────────────────────────────────────

    public void setBase(int playerId, Position pos) {
        bases.put(playerId, pos);
    }

    public Optional<Position> basePosition(int playerId) {
        return Optional.ofNullable(bases.get(playerId));
    }

    public Map<Integer, Position> getBases() {
        return Collections.unmodifiableMap(bases);
    }

    // ── geometry ────────────────────────────────────────────────────────

    public List<Position> neighbors(Position pos) {
        if (!isValid(pos)) {
            return List.of();
        }
        List<Position> result = new ArrayList<>(adjacency.maxNeighbors());
        for (int[] offset : adjacency.offsets()) {
            int row = pos.row() + offset[0];
            int col = pos.col() + offset[1];
            if (row >= 0 && row < size && col >= 0 && col < size) {
                result.add(new Position(row, col));
            }
        }
        return result;
    }

    public boolean isAdjacent(Position a, Position b) {
        return isValid(a) && isValid(b) && adjacency.isAdjacent(a, b);
    }

    public boolean isEdge(Position pos) {
        return isValid(pos) && (pos.row() == 0 || pos.row() == size - 1
                || pos.col() == 0 || pos.col() == size - 1);
    }

    public boolean isCorner(Position pos) {
        return isValid(pos) && (pos.row() == 0 || pos.row() == size - 1)
                && (pos.col() == 0 || pos.col() == size - 1);
    }

    public List<Position> emptyNeighbors(Position pos) {
        List<Position> result = new ArrayList<>();
        for (Position n : neighbors(pos)) {
            if (cells[index(n)].isEmpty()) {
                result.add(n);
            }
        }
        return result;
    }

    // ── territory ───────────────────────────────────────────────────────

    public List<Position> cellsOwnedBy(int playerId) {
        List<Position> result = new ArrayList<>();
        for (int i = 0; i < cells.length; i++) {
            if (cells[i].isOwnedBy(playerId)) {
                result.add(position(i));
            }
        }
        return result;
    }

    public int countCells(int playerId) {
        int count = 0;
        for (CellState cell : cells) {
            if (cell.isOwnedBy(playerId)) {
                count++;
            }
        }
        return count;
    }

    public List<Position> emptyCells() {
        List<Position> result = new ArrayList<>();
        for (int i = 0; i < cells.length; i++) {
            if (cells[i].isEmpty()) {
                result.add(position(i));
            }
        }
        return result;
    }

    /**
     * Cells connected to the player's base through the player's own cells. When the base
     * is missing or captured, the search starts from the first owned cell instead.
     */
    public List<Position> reachableCells(int playerId) {
        boolean[] reached = reachableMask(playerId);
        List<Position> result = new ArrayList<>();
        for (int i = 0; i < reached.length; i++) {
            if (reached[i]) {
                result.add(position(i));
            }
        }
        return result;
    }

    /**
     * Row-major mask of {@link #reachableCells(int)}.
     */
    public boolean[] reachableMask(int playerId) {
        boolean[] visited = new boolean[cells.length];
        Position start = searchStart(playerId);
        if (start == null) {
            return visited;
        }

        Deque<Position> queue = new ArrayDeque<>();
        visited[index(start)] = true;
        queue.add(start);
        while (!queue.isEmpty()) {
            Position current = queue.poll();
            for (Position neighbor : neighbors(current)) {
                int i = index(neighbor);
                if (!visited[i] && cells[i].isOwnedBy(playerId)) {
                    visited[i] = true;
                    queue.add(neighbor);
                }
            }
        }
        return visited;
    }

    public boolean isLegalOrigin(int playerId, Position pos) {
        if (!isOwnedBy(pos, playerId)) {
            return false;
        }
        return reachableMask(playerId)[index(pos)];
    }

    private Position searchStart(int playerId) {
        Position base = bases.get(playerId);
        if (base != null && isOwnedBy(base, playerId)) {
            return base;
        }
        for (int i = 0; i < cells.length; i++) {
            if (cells[i].isOwnedBy(playerId)) {
                return position(i);
            }
        }
        return null;
    }

    // ── moves ───────────────────────────────────────────────────────────

    /**
     * All legal moves for a player. Each (target, type) pair appears once, with the
     * first origin found in row-major order. A player without cells may place on any
     * empty cell.
     */
    public List<Move> legalMoves(int playerId) {
        List<Move> moves = new ArrayList<>();
        boolean[] reached = reachableMask(playerId);

        boolean anyReached = false;
        for (boolean r : reached) {
            if (r) {
                anyReached = true;
                break;
            }
        }
        if (!anyReached) {
            for (int i = 0; i < cells.length; i++) {
                if (cells[i].isEmpty()) {
                    Position pos = position(i);
                    moves.add(Move.grow(pos, pos));
                }
            }
            return moves;
        }

        boolean[] seenGrow = new boolean[cells.length];
        boolean[] seenAttack = new boolean[cells.length];
        for (int i = 0; i < reached.length; i++) {
            if (!reached[i]) {
                continue;
            }
            Position origin = position(i);
            for (Position target : neighbors(origin)) {
                int t = index(target);
                CellState cell = cells[t];
                if (cell.isEmpty() && !seenGrow[t]) {
                    seenGrow[t] = true;
                    moves.add(Move.grow(target, origin));
                } else if (cell.isAttackableBy(playerId) && !seenAttack[t]) {
                    seenAttack[t] = true;
                    moves.add(Move.attack(target, origin));
                }
            }
        }
        return moves;
    }

    /**
     * Checks a single move against the connectivity rule and the target's state.
     */
    public boolean isLegal(Move move, int playerId) {
        if (move == null || !isValid(move.target())) {
            return false;
        }
        if (countCells(playerId) == 0) {
            return move.type() == MoveType.GROW && isEmpty(move.target())
                    && move.target().equals(move.origin());
        }
        if (!isLegalOrigin(playerId, move.origin()) || !isAdjacent(move.origin(), move.target())) {
            return false;
        }
        return switch (move.type()) {
            case GROW -> isEmpty(move.target());
            case ATTACK -> isAttackableBy(move.target(), playerId);
        };
    }

    /**
     * Returns a new board with the move's target owned by {@code playerId}.
     */
    public Board apply(Move move, int playerId) {
        Board next = copy();
        next.setCell(move.target(), CellState.owned(playerId));
        return next;
    }

    /**
     * Cells a player may turn neutral: its own cells.
     */
    public List<Position> legalBlockPositions(int playerId) {
        return cellsOwnedBy(playerId);
    }

    private int index(Position pos) {
        return pos.row() * size + pos.col();
    }

    private Position position(int index) {
        return new Position(index / size, index % size);
    }
}
