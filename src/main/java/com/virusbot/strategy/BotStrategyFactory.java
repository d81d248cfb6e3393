package com.virusbot.strategy;

import com.virusbot.config.BotProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Resolves a {@link StrategyType} to the configured strategy instance.
 */
@Service
@RequiredArgsConstructor
public class BotStrategyFactory {

    private final HeuristicBotStrategy heuristicStrategy;
    private final MctsBotStrategy mctsStrategy;
    private final BotProperties properties;

    /**
     * Get the strategy for a type; {@code null} selects the configured default.
     */
    public BotStrategy getStrategy(StrategyType type) {
        if (type == null) {
            type = properties.getStrategy();
        }
        if (type == null) {
            type = StrategyType.HEURISTIC;
        }

        return switch (type) {
            case HEURISTIC -> heuristicStrategy;
            case MCTS -> mctsStrategy;
        };
    }

    /**
     * Strategy selected by {@code virusbot.strategy}.
     */
    public BotStrategy getDefaultStrategy() {
        return getStrategy(null);
    }
}
