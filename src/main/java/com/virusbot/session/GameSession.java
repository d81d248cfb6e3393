package com.virusbot.session;

import com.virusbot.exception.ProtocolException;
import com.virusbot.model.Adjacency;
import com.virusbot.model.Board;
import com.virusbot.model.CellState;
import com.virusbot.model.Player;
import com.virusbot.model.Position;
import com.virusbot.model.TurnState;
import com.virusbot.protocol.GameStartMessage;
import com.virusbot.protocol.MoveMadeMessage;
import com.virusbot.protocol.PlayerInfo;
import com.virusbot.protocol.TurnChangeMessage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The bot's mirror of one running game, updated from server messages.
 * All access is synchronized: updates arrive on the connection thread while turns are
 * played on the session executor.
 */
public class GameSession {

    private final String gameId;
    private final int ownPlayerId;
    private final int actionsPerTurn;
    private final Board board;
    private final List<Player> roster;
    private final Set<Integer> placedPlayers = new HashSet<>();

    private int currentPlayerId;
    private int movesLeft;
    private int unconfirmedMoves;

    GameSession(String gameId, int ownPlayerId, int actionsPerTurn, Board board,
                List<Player> roster, int currentPlayerId) {
        this.gameId = gameId == null ? "" : gameId;
        this.ownPlayerId = ownPlayerId;
        this.actionsPerTurn = actionsPerTurn;
        this.board = board;
        this.roster = List.copyOf(roster);
        this.currentPlayerId = currentPlayerId;
        this.movesLeft = actionsPerTurn;
        for (Player player : roster) {
            if (board.countCells(player.getId()) > 0) {
                placedPlayers.add(player.getId());
            }
        }
    }

    /**
     * Builds the session from either {@code game_start} format. Without a board, the two
     * players get placeholder bases in opposite corners.
     *
     * @throws ProtocolException if the board holds invalid cell values
     */
    public static GameSession fromGameStart(GameStartMessage message, Adjacency adjacency, int actionsPerTurn) {
        if (message.hasDimensionsOnly()) {
            int size = message.rows();
            List<Player> roster = List.of(
                    placeholder(1, new Position(0, 0)),
                    placeholder(2, new Position(size - 1, size - 1)));
            return new GameSession(message.gameId(), message.yourPlayer(), actionsPerTurn,
                    new Board(size, adjacency), roster, message.yourPlayer());
        }

        List<Player> roster = new ArrayList<>();
        Map<Integer, Position> bases = new HashMap<>();
        for (PlayerInfo info : message.playersOrEmpty()) {
            roster.add(Player.builder()
                    .id(info.id())
                    .name(info.name())
                    .basePosition(info.position())
                    .build());
            if (info.position() != null) {
                bases.put(info.id(), info.position());
            }
        }

        try {
            Board board = Board.fromPacked(message.board(), bases, adjacency);
            return new GameSession(message.gameId(), message.yourPlayerId(), actionsPerTurn,
                    board, roster, message.currentPlayer());
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Invalid game_start board: " + e.getMessage(), e);
        }
    }

    private static Player placeholder(int id, Position base) {
        return Player.builder().id(id).name("Player " + id).basePosition(base).build();
    }

    public String getGameId() {
        return gameId;
    }

    public int getOwnPlayerId() {
        return ownPlayerId;
    }

    public synchronized int getCurrentPlayerId() {
        return currentPlayerId;
    }

    public synchronized int getMovesLeft() {
        return movesLeft;
    }

    public synchronized boolean isMyTurn() {
        return currentPlayerId == ownPlayerId;
    }

    /**
     * Whether a message for {@code otherGameId} belongs to this game. Messages without a
     * game id always do.
     */
    public boolean isSameGame(String otherGameId) {
        return otherGameId == null || otherGameId.isEmpty() || gameId.isEmpty() || gameId.equals(otherGameId);
    }

    /**
     * Marks the cell as the mover's. When no moves are left the turn passes to the next
     * player in the roster.
     *
     * @return true if the turn just passed to the bot's own player
     */
    public synchronized boolean recordMove(MoveMadeMessage message) {
        Position target = new Position(message.row(), message.col());
        if (board.isValid(target)) {
            board.setCell(target, CellState.owned(message.player()));
            placedPlayers.add(message.player());
        }
        if (message.player() == ownPlayerId && unconfirmedMoves > 0) {
            unconfirmedMoves--;
        }

        if (message.movesLeft() > 0) {
            movesLeft = message.movesLeft();
            return false;
        }
        setCurrentPlayer(nextPlayerAfter(message.player()));
        movesLeft = actionsPerTurn;
        return currentPlayerId == ownPlayerId;
    }

    public synchronized void changeTurn(TurnChangeMessage message) {
        setCurrentPlayer(message.player());
        movesLeft = message.movesLeft() > 0 ? message.movesLeft() : actionsPerTurn;
    }

    private void setCurrentPlayer(int playerId) {
        currentPlayerId = playerId;
        if (playerId != ownPlayerId) {
            unconfirmedMoves = 0;
        }
    }

    /**
     * Counts a move the bot is about to send; the server's {@code move_made} echo
     * confirms it.
     */
    public synchronized void moveSent() {
        unconfirmedMoves++;
    }

    public synchronized void moveNotSent() {
        if (unconfirmedMoves > 0) {
            unconfirmedMoves--;
        }
    }

    public synchronized int getUnconfirmedMoves() {
        return unconfirmedMoves;
    }

    /**
     * Our turn, and every move already sent for it has been echoed back. Until then the
     * board and moves left are stale and must not be planned from.
     */
    public synchronized boolean isReadyToPlay() {
        return currentPlayerId == ownPlayerId && unconfirmedMoves == 0;
    }

    private int nextPlayerAfter(int playerId) {
        List<Player> alive = roster.stream().filter(p -> isAlive(p.getId())).toList();
        if (alive.isEmpty()) {
            return playerId;
        }
        for (int i = 0; i < alive.size(); i++) {
            if (alive.get(i).getId() == playerId) {
                return alive.get((i + 1) % alive.size()).getId();
            }
        }
        return alive.get(0).getId();
    }

    // a player that never placed a cell is still in the game
    private boolean isAlive(int playerId) {
        return !placedPlayers.contains(playerId) || board.countCells(playerId) > 0;
    }

    /**
     * Immutable view of the game for the strategies; the board is a copy.
     */
    public synchronized TurnState snapshot() {
        List<Player> players = roster.stream()
                .map(p -> p.withAlive(isAlive(p.getId())))
                .toList();
        return new TurnState(board.copy(), players, currentPlayerId, ownPlayerId, actionsPerTurn, movesLeft);
    }
}
