package com.virusbot.model;

/**
 * Owner and flag of a single board cell.
 * <p>
 * Owner {@value #NONE} is an empty cell, 1..{@value #MAX_PLAYER} are players and
 * {@value #NEUTRAL} is a killed, permanently inert cell. An empty cell is always
 * {@link CellFlag#NORMAL}; a neutral cell is always {@link CellFlag#KILLED}.
 *
 * @param owner owner id
 * @param flag  cell flag
 */
public record CellState(int owner, CellFlag flag) {

    public static final int NONE = 0;
    public static final int MAX_PLAYER = 4;
    public static final int NEUTRAL = 5;

    private static final int PLAYER_MASK = 0x0F;

    private static final CellState EMPTY = new CellState(NONE, CellFlag.NORMAL);
    private static final CellState NEUTRAL_CELL = new CellState(NEUTRAL, CellFlag.KILLED);

    public CellState {
        if (flag == null) {
            throw new IllegalArgumentException("Cell flag is required");
        }
        if (owner < NONE || owner > NEUTRAL) {
            throw new IllegalArgumentException("Invalid cell owner: " + owner);
        }
        if (owner == NONE && flag != CellFlag.NORMAL) {
            throw new IllegalArgumentException("An empty cell cannot carry flag " + flag);
        }
        if ((owner == NEUTRAL) != (flag == CellFlag.KILLED)) {
            throw new IllegalArgumentException("Neutral cells and only neutral cells are KILLED");
        }
    }

    public static CellState empty() {
        return EMPTY;
    }

    public static CellState neutral() {
        return NEUTRAL_CELL;
    }

    public static CellState owned(int playerId) {
        return owned(playerId, CellFlag.NORMAL);
    }

    public static CellState owned(int playerId, CellFlag flag) {
        if (playerId < 1 || playerId > MAX_PLAYER) {
            throw new IllegalArgumentException("Invalid player id: " + playerId);
        }
        return new CellState(playerId, flag);
    }

    /**
     * Decodes the packed server representation: low four bits are the owner,
     * bits {@code 0x30} the flag. A killed flag or owner 5 always means neutral.
     */
    public static CellState decode(int packed) {
        int owner = packed & PLAYER_MASK;
        CellFlag flag = CellFlag.fromBits(packed);
        if (owner == NEUTRAL || flag == CellFlag.KILLED) {
            return NEUTRAL_CELL;
        }
        if (owner == NONE) {
            return EMPTY;
        }
        if (owner > MAX_PLAYER) {
            throw new IllegalArgumentException("Invalid packed cell value: " + packed);
        }
        return new CellState(owner, flag);
    }

    public int encode() {
        if (isNeutral()) {
            return NEUTRAL;
        }
        return owner | flag.getBits();
    }

    public boolean isEmpty() {
        return owner == NONE;
    }

    public boolean isNeutral() {
        return owner == NEUTRAL;
    }

    public boolean isOwnedBy(int playerId) {
        return owner == playerId && owner != NONE && owner != NEUTRAL;
    }

    /**
     * Only normal cells of another player can be captured.
     */
    public boolean isAttackableBy(int playerId) {
        return owner != NONE && owner != NEUTRAL && owner != playerId && flag == CellFlag.NORMAL;
    }
}
