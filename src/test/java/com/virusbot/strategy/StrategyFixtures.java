package com.virusbot.strategy;

import com.virusbot.model.Board;
import com.virusbot.model.CellFlag;
import com.virusbot.model.CellState;
import com.virusbot.model.Move;
import com.virusbot.model.Player;
import com.virusbot.model.Position;
import com.virusbot.model.TurnState;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Board positions shared by the strategy tests.
 */
final class StrategyFixtures {

    private StrategyFixtures() {
    }

    static Position p(int row, int col) {
        return new Position(row, col);
    }

    static Player player(int id, Position base) {
        return Player.builder().id(id).name("Player " + id).basePosition(base).build();
    }

    /**
     * 5x5 board, player 1 based at (0,0), player 2 based at (4,4).
     */
    static Board openingBoard() {
        Board board = new Board(5);
        board.setCell(p(0, 0), CellState.owned(1, CellFlag.BASE));
        board.setBase(1, p(0, 0));
        board.setCell(p(4, 4), CellState.owned(2, CellFlag.BASE));
        board.setBase(2, p(4, 4));
        return board;
    }

    static TurnState openingState(int currentPlayer, int actingPlayer) {
        return new TurnState(openingBoard(),
                List.of(player(1, p(0, 0)), player(2, p(4, 4))),
                currentPlayer, actingPlayer);
    }

    /**
     * Empty board of the given size, nobody placed yet; bases are only known from the roster.
     */
    static TurnState emptyBoardState(int size, int actionsPerTurn) {
        return new TurnState(new Board(size),
                List.of(player(1, p(0, 0)), player(2, p(size - 1, size - 1))),
                1, 1, actionsPerTurn, actionsPerTurn);
    }

    /**
     * Plays {@code moves} for the acting player one after the other and fails on the
     * first one that is not legal at that point.
     */
    static void assertSequentiallyLegal(TurnState state, List<Move> moves) {
        TurnState current = state.withActionsLeft(Math.max(1, moves.size()));
        for (Move move : moves) {
            assertTrue(current.getBoard().isLegal(move, state.getActingPlayerId()),
                    move + " illegal after " + current);
            current = current.apply(move);
        }
    }

    /**
     * Player 2's base at (2,2) surrounded by fortified player 1 cells; nothing to do.
     */
    static TurnState walledInState() {
        Board board = new Board(5);
        for (int row = 0; row < 5; row++) {
            for (int col = 0; col < 5; col++) {
                board.setCell(p(row, col), CellState.owned(1, CellFlag.FORTIFIED));
            }
        }
        board.setCell(p(0, 0), CellState.owned(1, CellFlag.BASE));
        board.setBase(1, p(0, 0));
        board.setCell(p(2, 2), CellState.owned(2, CellFlag.BASE));
        board.setBase(2, p(2, 2));
        return new TurnState(board, List.of(player(1, p(0, 0)), player(2, p(2, 2))), 2, 2);
    }
}
