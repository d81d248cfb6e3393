package com.virusbot.strategy;

import com.virusbot.model.Move;

/**
 * Weighted contribution of each heuristic factor to a move's score.
 */
public record MoveScore(
        Move move,
        double territoryGain,
        double strategicPosition,
        double threatRemoval,
        double connectivity,
        double expansionPotential,
        double defensiveValue
) {

    public double total() {
        return territoryGain + strategicPosition + threatRemoval
                + connectivity + expansionPotential + defensiveValue;
    }
}
