package com.virusbot.strategy;

import com.virusbot.model.Move;
import com.virusbot.model.Position;
import com.virusbot.model.TurnState;

import java.util.List;

/**
 * Decision capability shared by every strategy.
 * <p>
 * Implementations never modify the snapshot they receive and never return {@code null}:
 * an empty list means there is nothing to do (not our turn, unknown player, no legal move).
 */
public interface BotStrategy {

    /**
     * Choose up to {@code count} actions for the acting player, in play order.
     */
    List<Move> decideMoves(TurnState state, int count);

    /**
     * Choose the two cells to turn neutral, or nothing.
     */
    List<Position> decideBlocks(TurnState state);

    StrategyType getType();
}
