package com.virusbot.config;

import com.virusbot.model.Adjacency;
import com.virusbot.strategy.EvaluationWeights;
import com.virusbot.strategy.SearchSettings;
import com.virusbot.strategy.StrategyType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Bot settings bound from {@code virusbot.*} (application.yml, environment variables
 * such as {@code VIRUSBOT_MCTS_ITERATIONS}, or command-line arguments).
 */
@Data
@ConfigurationProperties(prefix = "virusbot")
public class BotProperties {

    private String serverUrl = "ws://localhost:8080/ws";

    private String name = "VirusBot";

    /** Lobby joined after the welcome message; empty means none. */
    private String lobbyId = "";

    private boolean autoCreate = false;

    private int lobbyBoardSize = 10;

    private boolean autoAcceptChallenge = true;

    private boolean autoConnect = true;

    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Pause before each move is sent. */
    private Duration moveDelay = Duration.ofMillis(500);

    private StrategyType strategy = StrategyType.HEURISTIC;

    private Rules rules = new Rules();

    private Mcts mcts = new Mcts();

    private Weights weights = new Weights();

    public boolean hasLobbyId() {
        return lobbyId != null && !lobbyId.isBlank();
    }

    public EvaluationWeights toWeights() {
        return new EvaluationWeights(weights.getTerritory(), weights.getStrategic(), weights.getThreat(),
                weights.getConnectivity(), weights.getExpansion(), weights.getDefensive());
    }

    public SearchSettings toSearchSettings() {
        return new SearchSettings(mcts.getIterations(), mcts.getTimeLimit(), mcts.getUctConstant(),
                mcts.getMaxDepth(), mcts.getWorkers());
    }

    @Data
    public static class Rules {
        private int actionsPerTurn = 3;
        private Adjacency adjacency = Adjacency.MOORE;
    }

    @Data
    public static class Mcts {
        private int iterations = 1000;
        private Duration timeLimit = Duration.ofSeconds(1);
        private double uctConstant = 1.41;
        private int maxDepth = 50;
        private int workers = 1;
        /** Fixed seed for reproducible rollouts; unset draws one per run. */
        private Long seed;
    }

    @Data
    public static class Weights {
        private double territory = 1.0;
        private double strategic = 0.5;
        private double threat = 1.5;
        private double connectivity = 0.3;
        private double expansion = 0.4;
        private double defensive = 0.2;
    }
}
