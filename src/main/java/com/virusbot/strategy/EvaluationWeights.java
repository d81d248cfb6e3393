package com.virusbot.strategy;

/**
 * Multipliers applied to the six heuristic factors.
 *
 * @param territoryGain      weight of the per-cell capture value
 * @param strategicPosition  weight of the corner/edge bonus
 * @param threatRemoval      weight of the attack bonus
 * @param connectivity       weight of the reconnection bonus
 * @param expansionPotential weight of the open-frontier bonus
 * @param defensiveValue     weight of the base-proximity bonus
 */
public record EvaluationWeights(
        double territoryGain,
        double strategicPosition,
        double threatRemoval,
        double connectivity,
        double expansionPotential,
        double defensiveValue
) {

    public static EvaluationWeights defaults() {
        return new EvaluationWeights(1.0, 0.5, 1.5, 0.3, 0.4, 0.2);
    }
}
