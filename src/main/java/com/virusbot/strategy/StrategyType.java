package com.virusbot.strategy;

/**
 * Available move-selection strategies.
 */
public enum StrategyType {
    HEURISTIC,
    MCTS
}
