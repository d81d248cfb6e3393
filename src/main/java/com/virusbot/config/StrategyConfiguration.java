package com.virusbot.config;

import com.virusbot.strategy.HeuristicBotStrategy;
import com.virusbot.strategy.MctsBotStrategy;
import com.virusbot.strategy.SearchSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Builds the strategies from {@link BotProperties}. The strategy classes themselves
 * stay free of Spring types.
 */
@Configuration
@Slf4j
public class StrategyConfiguration {

    @Bean
    public HeuristicBotStrategy heuristicBotStrategy(BotProperties properties) {
        return new HeuristicBotStrategy(properties.toWeights());
    }

    @Bean(destroyMethod = "close")
    public MctsBotStrategy mctsBotStrategy(BotProperties properties, HeuristicBotStrategy heuristicBotStrategy) {
        SearchSettings settings = properties.toSearchSettings();
        Long seed = properties.getMcts().getSeed();
        Random random = seed != null ? new Random(seed) : new Random();
        log.debug("MCTS settings {} (seed {})", settings, seed != null ? seed : "random");
        return new MctsBotStrategy(settings, heuristicBotStrategy, random);
    }
}
