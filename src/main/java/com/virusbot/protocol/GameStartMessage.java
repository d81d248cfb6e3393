package com.virusbot.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Start of a game, in either of the two formats the server sends.
 * <p>
 * The board format carries {@code board}, {@code players}, {@code currentPlayer} and
 * {@code yourPlayerId}. The dimensions format carries {@code gameId}, the opponent,
 * {@code yourPlayer} and {@code rows}/{@code cols} but no board.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GameStartMessage(
        int[][] board,
        List<PlayerInfo> players,
        int currentPlayer,
        int yourPlayerId,
        String gameId,
        String opponentId,
        String opponentUsername,
        int yourPlayer,
        int rows,
        int cols
) implements ServerMessage {

    @Override
    public MessageType type() {
        return MessageType.GAME_START;
    }

    /**
     * True for the dimensions-only format: no board, positive {@code rows}.
     */
    public boolean hasDimensionsOnly() {
        return board == null && rows > 0;
    }

    public int ownPlayerId() {
        return hasDimensionsOnly() ? yourPlayer : yourPlayerId;
    }

    public List<PlayerInfo> playersOrEmpty() {
        return players == null ? List.of() : players;
    }
}
