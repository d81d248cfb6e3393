package com.virusbot.strategy;

import com.virusbot.model.Board;
import com.virusbot.model.Move;
import com.virusbot.model.Player;
import com.virusbot.model.Position;
import com.virusbot.model.TurnState;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic scoring of moves and of neutral-block cells for the acting player.
 * Each move factor is a fixed raw value scaled by its {@link EvaluationWeights} entry,
 * and the score is their sum.
 */
public class MoveEvaluator {

    static final double TERRITORY_VALUE = 10.0;
    static final double CORNER_VALUE = 8.0;
    static final double EDGE_VALUE = 5.0;
    static final double ATTACK_VALUE = 15.0;
    static final double CONNECTIVITY_VALUE = 3.0;
    static final double EXPANSION_VALUE_PER_CELL = 4.0;
    static final double DEFENSIVE_VALUE = 2.0;

    static final double BLOCK_PATH_VALUE = 20.0;
    static final double BLOCK_CHOKEPOINT_VALUE = 15.0;
    static final double BLOCK_CORNER_VALUE = 10.0;
    static final double BLOCK_DENIAL_PER_CELL = 3.0;
    static final double BLOCK_SELF_PENALTY = 10.0;

    private final EvaluationWeights weights;

    public MoveEvaluator(EvaluationWeights weights) {
        if (weights == null) {
            throw new IllegalArgumentException("Evaluation weights are required");
        }
        this.weights = weights;
    }

    public EvaluationWeights getWeights() {
        return weights;
    }

    /**
     * Scores every move in enumeration order.
     */
    public List<MoveScore> scoreMoves(List<Move> moves, TurnState state) {
        Context context = new Context(state);
        List<MoveScore> scores = new ArrayList<>(moves.size());
        for (Move move : moves) {
            scores.add(score(move, context));
        }
        return scores;
    }

    public MoveScore score(Move move, TurnState state) {
        return score(move, new Context(state));
    }

    private MoveScore score(Move move, Context context) {
        Board board = context.board;
        Position target = move.target();

        double strategic = 0;
        if (board.isCorner(target)) {
            strategic = CORNER_VALUE;
        } else if (board.isEdge(target)) {
            strategic = EDGE_VALUE;
        }

        double threat = move.isAttack() ? ATTACK_VALUE : 0;
        double connectivity = repairsConnectivity(target, context) ? CONNECTIVITY_VALUE : 0;
        double expansion = board.emptyNeighbors(target).size() * EXPANSION_VALUE_PER_CELL;
        double defensive = hasDefensiveValue(target, context) ? DEFENSIVE_VALUE : 0;

        return new MoveScore(move,
                TERRITORY_VALUE * weights.territoryGain(),
                strategic * weights.strategicPosition(),
                threat * weights.threatRemoval(),
                connectivity * weights.connectivity(),
                expansion * weights.expansionPotential(),
                defensive * weights.defensiveValue());
    }

    // target is not yet part of the connected territory but touches it
    private boolean repairsConnectivity(Position target, Context context) {
        Board board = context.board;
        if (board.isValid(target) && context.reachable[target.row() * board.getSize() + target.col()]) {
            return false;
        }
        for (Position neighbor : board.neighbors(target)) {
            if (context.reachable[neighbor.row() * board.getSize() + neighbor.col()]) {
                return true;
            }
        }
        return false;
    }

    private boolean hasDefensiveValue(Position target, Context context) {
        Board board = context.board;
        if (context.ownBase != null && board.isAdjacent(target, context.ownBase)) {
            return true;
        }
        for (Position opponentBase : context.opponentBases) {
            if (board.isAdjacent(target, opponentBase)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Scores a cell of the acting player as a neutral-block candidate.
     */
    public double scoreBlock(Position pos, TurnState state) {
        return scoreBlock(pos, new Context(state));
    }

    public List<Double> scoreBlocks(List<Position> positions, TurnState state) {
        Context context = new Context(state);
        List<Double> scores = new ArrayList<>(positions.size());
        for (Position pos : positions) {
            scores.add(scoreBlock(pos, context));
        }
        return scores;
    }

    private double scoreBlock(Position pos, Context context) {
        Board board = context.board;
        double score = 0;

        for (Position opponentBase : context.opponentBases) {
            if (board.isAdjacent(pos, opponentBase)) {
                score += BLOCK_PATH_VALUE;
            }
        }

        int edgeNeighbors = 0;
        for (Position neighbor : board.neighbors(pos)) {
            if (board.isEdge(neighbor)) {
                edgeNeighbors++;
            }
        }
        if (edgeNeighbors >= 2) {
            score += BLOCK_CHOKEPOINT_VALUE;
        }

        if (board.isCorner(pos)) {
            score += BLOCK_CORNER_VALUE;
        }

        score += board.emptyNeighbors(pos).size() * BLOCK_DENIAL_PER_CELL;

        if (context.ownBase != null && board.isAdjacent(pos, context.ownBase)) {
            score -= BLOCK_SELF_PENALTY;
        }
        return score;
    }

    /**
     * Per-snapshot data shared by every score of one decision.
     */
    private static final class Context {
        private final Board board;
        private final boolean[] reachable;
        private final Position ownBase;
        private final List<Position> opponentBases;

        Context(TurnState state) {
            this.board = state.getBoard();
            int acting = state.getActingPlayerId();
            this.reachable = board.reachableMask(acting);
            this.ownBase = state.basePosition(acting).orElse(null);
            this.opponentBases = new ArrayList<>();
            for (Player opponent : state.opponents()) {
                state.basePosition(opponent.getId()).ifPresent(opponentBases::add);
            }
        }
    }
}
