package com.virusbot.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of a game at one decision point: board, roster in rotation order,
 * whose turn it is and which player the bot controls.
 * <p>
 * A player takes {@code actionsPerTurn} actions before the turn passes;
 * {@code actionsLeft} counts what remains of the current player's turn. Every
 * transition returns a new state on a copied board.
 */
public final class TurnState {

    private final Board board;
    private final List<Player> players;
    private final int currentPlayerId;
    private final int actingPlayerId;
    private final int actionsPerTurn;
    private final int actionsLeft;

    public TurnState(Board board, List<Player> players, int currentPlayerId, int actingPlayerId) {
        this(board, players, currentPlayerId, actingPlayerId, 1, 1);
    }

    public TurnState(Board board, List<Player> players, int currentPlayerId, int actingPlayerId,
                     int actionsPerTurn, int actionsLeft) {
        if (board == null) {
            throw new IllegalArgumentException("Board is required");
        }
        if (actionsPerTurn < 1) {
            throw new IllegalArgumentException("actionsPerTurn must be at least 1: " + actionsPerTurn);
        }
        this.board = board;
        this.players = players == null ? List.of() : List.copyOf(players);
        this.currentPlayerId = currentPlayerId;
        this.actingPlayerId = actingPlayerId;
        this.actionsPerTurn = actionsPerTurn;
        this.actionsLeft = Math.max(1, actionsLeft);
    }

    public Board getBoard() {
        return board;
    }

    public List<Player> getPlayers() {
        return players;
    }

    public int getCurrentPlayerId() {
        return currentPlayerId;
    }

    public int getActingPlayerId() {
        return actingPlayerId;
    }

    public int getActionsPerTurn() {
        return actionsPerTurn;
    }

    public int getActionsLeft() {
        return actionsLeft;
    }

    /**
     * Same position, with the current player holding {@code actionsLeft} actions.
     */
    public TurnState withActionsLeft(int actionsLeft) {
        return new TurnState(board.copy(), players, currentPlayerId, actingPlayerId, actionsPerTurn, actionsLeft);
    }

    public TurnState copy() {
        return new TurnState(board.copy(), players, currentPlayerId, actingPlayerId, actionsPerTurn, actionsLeft);
    }

    // ── queries ─────────────────────────────────────────────────────────

    public boolean isActingPlayersTurn() {
        return currentPlayerId == actingPlayerId;
    }

    public Optional<Player> findPlayer(int playerId) {
        return players.stream().filter(p -> p.getId() == playerId).findFirst();
    }

    public Optional<Player> actingPlayer() {
        return findPlayer(actingPlayerId);
    }

    public Optional<Player> currentPlayer() {
        return findPlayer(currentPlayerId);
    }

    public List<Player> alivePlayers() {
        return players.stream().filter(Player::isAlive).toList();
    }

    /**
     * Alive players other than the acting player.
     */
    public List<Player> opponents() {
        return players.stream()
                .filter(p -> p.getId() != actingPlayerId && p.isAlive())
                .toList();
    }

    public boolean isTerminal() {
        return alivePlayers().size() <= 1;
    }

    public Optional<Player> soleSurvivor() {
        List<Player> alive = alivePlayers();
        return alive.size() == 1 ? Optional.of(alive.get(0)) : Optional.empty();
    }

    /**
     * Base of a player: the board's base map first, the roster record otherwise.
     */
    public Optional<Position> basePosition(int playerId) {
        Optional<Position> fromBoard = board.basePosition(playerId);
        if (fromBoard.isPresent()) {
            return fromBoard;
        }
        return findPlayer(playerId).map(Player::getBasePosition);
    }

    public List<Move> legalMovesForCurrentPlayer() {
        return board.legalMoves(currentPlayerId);
    }

    // ── transitions ─────────────────────────────────────────────────────

    /**
     * Plays a move for the current player. A captured cell's previous owner is
     * eliminated when it has no cell left.
     */
    public TurnState apply(Move move) {
        int mover = currentPlayerId;
        CellState previous = board.cellAt(move.target());
        Board nextBoard = board.apply(move, mover);

        List<Player> nextPlayers = new ArrayList<>(players);
        if (!previous.isEmpty() && !previous.isNeutral() && previous.owner() != mover) {
            refreshAlive(nextPlayers, previous.owner(), nextBoard);
        }

        if (actionsLeft > 1) {
            return new TurnState(nextBoard, nextPlayers, mover, actingPlayerId, actionsPerTurn, actionsLeft - 1);
        }
        return new TurnState(nextBoard, nextPlayers, nextPlayerAfter(mover, nextPlayers),
                actingPlayerId, actionsPerTurn, actionsPerTurn);
    }

    /**
     * Turns up to two of the acting player's cells neutral and ends its turn.
     */
    public TurnState applyBlocks(List<Position> positions) {
        Board nextBoard = board.copy();
        positions.stream()
                .limit(2)
                .filter(pos -> nextBoard.isOwnedBy(pos, actingPlayerId))
                .forEach(pos -> nextBoard.setCell(pos, CellState.neutral()));

        List<Player> nextPlayers = new ArrayList<>(players);
        for (int i = 0; i < nextPlayers.size(); i++) {
            Player p = nextPlayers.get(i);
            if (p.getId() == actingPlayerId) {
                nextPlayers.set(i, p.withBlocksUsed(true));
            }
        }
        refreshAlive(nextPlayers, actingPlayerId, nextBoard);

        return new TurnState(nextBoard, nextPlayers, nextPlayerAfter(currentPlayerId, nextPlayers),
                actingPlayerId, actionsPerTurn, actionsPerTurn);
    }

    /**
     * Ends the current player's turn without acting.
     */
    public TurnState passTurn() {
        return new TurnState(board.copy(), players, nextPlayerAfter(currentPlayerId, players),
                actingPlayerId, actionsPerTurn, actionsPerTurn);
    }

    private static void refreshAlive(List<Player> roster, int playerId, Board board) {
        boolean alive = board.countCells(playerId) > 0;
        for (int i = 0; i < roster.size(); i++) {
            Player p = roster.get(i);
            if (p.getId() == playerId && p.isAlive() != alive) {
                roster.set(i, p.withAlive(alive));
            }
        }
    }

    /**
     * Next alive player in roster order after {@code playerId}; the player itself when
     * nobody else is alive.
     */
    private static int nextPlayerAfter(int playerId, List<Player> roster) {
        if (roster.isEmpty()) {
            return playerId;
        }
        int start = -1;
        for (int i = 0; i < roster.size(); i++) {
            if (roster.get(i).getId() == playerId) {
                start = i;
                break;
            }
        }
        for (int step = 1; step <= roster.size(); step++) {
            Player candidate = roster.get(Math.floorMod(start + step, roster.size()));
            if (candidate.isAlive()) {
                return candidate.getId();
            }
        }
        return playerId;
    }

    @Override
    public String toString() {
        return "TurnState{current=" + currentPlayerId + ", acting=" + actingPlayerId
                + ", actionsLeft=" + actionsLeft + "/" + actionsPerTurn
                + ", alive=" + alivePlayers().stream().map(Player::getId).toList() + "}";
    }
}
