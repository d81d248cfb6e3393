package com.virusbot.strategy;

import com.virusbot.model.Move;
import com.virusbot.model.Player;
import com.virusbot.model.Position;
import com.virusbot.model.TurnState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Heuristic strategy - scores every legal move with {@link MoveEvaluator} and takes
 * the best ones, spreading them over different origin cells when it can.
 */
@Slf4j
public class HeuristicBotStrategy implements BotStrategy {

    private static final int BLOCK_COUNT = 2;

    private final MoveEvaluator evaluator;

    public HeuristicBotStrategy(EvaluationWeights weights) {
        this(new MoveEvaluator(weights));
    }

    public HeuristicBotStrategy(MoveEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.HEURISTIC;
    }

    public MoveEvaluator getEvaluator() {
        return evaluator;
    }

    @Override
    public List<Move> decideMoves(TurnState state, int count) {
        Optional<Player> acting = actingPlayerOnTurn(state);
        if (acting.isEmpty() || count <= 0) {
            return List.of();
        }

        int actingId = acting.get().getId();
        List<Move> legalMoves = state.getBoard().legalMoves(actingId);
        if (legalMoves.isEmpty()) {
            return List.of();
        }
        if (state.getBoard().countCells(actingId) == 0) {
            return planFromPlacement(state, legalMoves, count);
        }
        if (legalMoves.size() <= count) {
            return legalMoves;
        }

        List<Move> selected = selectDiverseMoves(rankMoves(state, legalMoves), count);
        log.debug("Heuristic picked {} of {} moves for player {}: {}",
                selected.size(), legalMoves.size(), acting.get().getId(), selected);
        return selected;
    }

    // Only the first placement is legal on this snapshot; the rest of the turn grows
    // from the placed cell.
    private List<Move> planFromPlacement(TurnState state, List<Move> placements, int count) {
        Move placement = rankMoves(state, placements).get(0).move();
        List<Move> planned = new ArrayList<>(count);
        planned.add(placement);

        if (count > 1) {
            TurnState next = state.withActionsLeft(count).apply(placement);
            planned.addAll(decideMoves(next, count - 1));
        }
        log.debug("Heuristic opening for player {}: {}", state.getActingPlayerId(), planned);
        return planned;
    }

    /**
     * Scores and sorts moves, best first. Equal scores keep enumeration order.
     */
    public List<MoveScore> rankMoves(TurnState state, List<Move> moves) {
        List<MoveScore> scored = new ArrayList<>(evaluator.scoreMoves(moves, state));
        scored.sort(Comparator.comparingDouble(MoveScore::total).reversed());
        return scored;
    }

    // A move whose origin is already used is skipped until count - 1 origins are covered,
    // then skipped moves fill whatever is left.
    private List<Move> selectDiverseMoves(List<MoveScore> ranked, int count) {
        List<Move> selected = new ArrayList<>(count);
        List<Move> skipped = new ArrayList<>();
        Set<Position> usedOrigins = new HashSet<>();

        for (MoveScore score : ranked) {
            if (selected.size() >= count) {
                break;
            }
            Move move = score.move();
            if (!usedOrigins.contains(move.origin()) || usedOrigins.size() >= count - 1) {
                selected.add(move);
                usedOrigins.add(move.origin());
            } else {
                skipped.add(move);
            }
        }

        for (Move move : skipped) {
            if (selected.size() >= count) {
                break;
            }
            selected.add(move);
        }
        return selected;
    }

    @Override
    public List<Position> decideBlocks(TurnState state) {
        Optional<Player> acting = actingPlayerOnTurn(state);
        if (acting.isEmpty() || acting.get().isBlocksUsed()) {
            return List.of();
        }

        List<Position> candidates = state.getBoard().legalBlockPositions(acting.get().getId());
        if (candidates.size() < BLOCK_COUNT) {
            return List.of();
        }

        List<Double> scores = evaluator.scoreBlocks(candidates, state);
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer i) -> scores.get(i)).reversed());

        List<Position> blocks = order.stream()
                .limit(BLOCK_COUNT)
                .map(candidates::get)
                .toList();
        log.debug("Heuristic block placement for player {}: {}", acting.get().getId(), blocks);
        return blocks;
    }

    static Optional<Player> actingPlayerOnTurn(TurnState state) {
        if (state == null || !state.isActingPlayersTurn()) {
            return Optional.empty();
        }
        return state.actingPlayer();
    }
}
