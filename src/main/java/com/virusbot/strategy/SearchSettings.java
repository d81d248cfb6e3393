package com.virusbot.strategy;

import java.time.Duration;

/**
 * Limits and constants of the tree search.
 *
 * @param iterations          iteration cap for a whole turn
 * @param timeLimit           wall-clock budget for a whole turn
 * @param explorationConstant UCT exploration constant C
 * @param maxDepth            maximum plies of a random rollout
 * @param workers             number of threads running iterations
 */
public record SearchSettings(
        int iterations,
        Duration timeLimit,
        double explorationConstant,
        int maxDepth,
        int workers
) {

    public SearchSettings {
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must not be negative: " + iterations);
        }
        if (timeLimit == null || timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must be zero or positive");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1: " + workers);
        }
    }

    public static SearchSettings defaults() {
        return new SearchSettings(1000, Duration.ofSeconds(1), 1.41, 50, 1);
    }
}
