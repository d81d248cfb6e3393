package com.virusbot.strategy;

import com.virusbot.model.Move;
import com.virusbot.model.Player;
import com.virusbot.model.Position;
import com.virusbot.model.TurnState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Monte Carlo tree search over the acting player's actions.
 * <p>
 * One turn shares one {@link SearchBudget}. The first action is the best child of the
 * root; that child then becomes the root for the next action, keeping its statistics.
 * When the budget produced no visited child, the remaining actions come from the
 * heuristic strategy. Block placement always comes from the heuristic strategy.
 */
@Slf4j
public class MctsBotStrategy implements BotStrategy, AutoCloseable {

    private final SearchSettings settings;
    private final HeuristicBotStrategy heuristic;
    private final Random random;
    private final ExecutorService workerPool;

    public MctsBotStrategy(SearchSettings settings, HeuristicBotStrategy heuristic, Random random) {
        if (settings == null || heuristic == null || random == null) {
            throw new IllegalArgumentException("Settings, heuristic strategy and random source are required");
        }
        this.settings = settings;
        this.heuristic = heuristic;
        this.random = random;
        this.workerPool = settings.workers() > 1 ? newWorkerPool(settings.workers()) : null;
    }

    private static ExecutorService newWorkerPool(int workers) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "mcts-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public StrategyType getType() {
        return StrategyType.MCTS;
    }

    public SearchSettings getSettings() {
        return settings;
    }

    @Override
    public List<Move> decideMoves(TurnState state, int count) {
        Optional<Player> acting = HeuristicBotStrategy.actingPlayerOnTurn(state);
        if (acting.isEmpty() || count <= 0) {
            return List.of();
        }

        int actingId = acting.get().getId();
        List<Move> legalMoves = state.getBoard().legalMoves(actingId);
        if (legalMoves.isEmpty()) {
            return List.of();
        }
        // placements are only legal one at a time, so they always go through the tree
        if (legalMoves.size() <= count && state.getBoard().countCells(actingId) > 0) {
            return legalMoves;
        }

        SearchBudget budget = SearchBudget.start(settings.iterations(), settings.timeLimit());
        SearchNode root = SearchNode.root(state.withActionsLeft(count));
        List<Move> chosen = new ArrayList<>(count);
        int iterations = 0;

        for (int action = 0; action < count; action++) {
            TurnState current = root.getState();
            if (!current.isActingPlayersTurn() || current.isTerminal()
                    || current.legalMovesForCurrentPlayer().isEmpty()) {
                break;
            }

            iterations += search(root, budget.slice(count - action));
            SearchNode best = bestChild(root);
            if (best == null) {
                List<Move> rest = heuristic.decideMoves(current, count - action);
                log.debug("Search produced no visited child for action {}, heuristic supplies {}",
                        action + 1, rest);
                chosen.addAll(rest);
                break;
            }
            chosen.add(best.getMove());
            root = best;
        }

        log.debug("MCTS picked {} for player {} after {} iterations", chosen, acting.get().getId(), iterations);
        return chosen;
    }

    @Override
    public List<Position> decideBlocks(TurnState state) {
        return heuristic.decideBlocks(state);
    }

    /**
     * Runs iterations from {@code root} until the slice is used up. Returns how many ran.
     */
    int search(SearchNode root, SearchBudget.Slice slice) {
        if (workerPool == null) {
            return runIterations(root, slice, random);
        }

        List<Future<Integer>> futures = new ArrayList<>(settings.workers());
        for (int i = 0; i < settings.workers(); i++) {
            Random workerRandom = new Random(random.nextLong());
            futures.add(workerPool.submit(() -> runIterations(root, slice, workerRandom)));
        }

        int total = 0;
        for (Future<Integer> future : futures) {
            try {
                total += future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for search workers");
                futures.forEach(f -> f.cancel(true));
                break;
            } catch (ExecutionException e) {
                log.error("Search worker failed", e.getCause());
            }
        }
        return total;
    }

    private int runIterations(SearchNode root, SearchBudget.Slice slice, Random rng) {
        int count = 0;
        while (!Thread.currentThread().isInterrupted() && slice.tryAcquire()) {
            if (!iterate(root, rng)) {
                break;
            }
            count++;
        }
        return count;
    }

    /**
     * One selection, expansion, simulation and backpropagation pass. Every node is
     * simulated once, by the iteration that created it; selection never enters an
     * exhausted subtree. Returns false, without touching any statistics, once the whole
     * tree below {@code root} is exhausted.
     */
    boolean iterate(SearchNode root, Random rng) {
        SearchNode node = root;
        SearchNode leaf = null;
        while (leaf == null) {
            if (node.isLeaf()) {
                return false;
            }
            SearchNode expanded = node.expand(rng);
            if (expanded != null) {
                leaf = expanded;
                continue;
            }
            SearchNode next = node.selectChild(settings.explorationConstant());
            if (next != null) {
                node = next;
            } else if (node == root) {
                root.markExhausted();
                return false;
            } else {
                node.markExhausted();
                node = root;
            }
        }

        double reward = simulate(leaf.getState(), rng);
        for (SearchNode n = leaf; n != null; n = n == root ? null : n.getParent()) {
            n.record(reward);
        }
        return true;
    }

    /**
     * Random playout. A player without legal moves passes; the pass counts as a ply.
     */
    double simulate(TurnState start, Random rng) {
        int actingId = start.getActingPlayerId();
        TurnState state = start;
        for (int depth = 0; depth < settings.maxDepth() && !state.isTerminal(); depth++) {
            List<Move> moves = state.legalMovesForCurrentPlayer();
            state = moves.isEmpty()
                    ? state.passTurn()
                    : state.apply(moves.get(rng.nextInt(moves.size())));
        }
        return state.soleSurvivor()
                .filter(p -> p.getId() == actingId)
                .isPresent() ? 1.0 : 0.0;
    }

    /**
     * Most visited child; ties go to the higher mean reward, then to the heuristic's
     * ranking. {@code null} when no child has been visited.
     */
    SearchNode bestChild(SearchNode root) {
        List<SearchNode> visited = root.getChildren().stream()
                .filter(child -> child.getVisits() > 0)
                .toList();
        if (visited.isEmpty()) {
            return null;
        }

        Map<Move, Integer> rank = new HashMap<>();
        List<Move> moves = visited.stream().map(SearchNode::getMove).toList();
        List<MoveScore> ranked = heuristic.rankMoves(root.getState(), moves);
        for (int i = 0; i < ranked.size(); i++) {
            rank.put(ranked.get(i).move(), i);
        }

        SearchNode best = null;
        for (SearchNode child : visited) {
            if (best == null || isBetter(child, best, rank)) {
                best = child;
            }
        }
        return best;
    }

    private static boolean isBetter(SearchNode candidate, SearchNode current, Map<Move, Integer> rank) {
        if (candidate.getVisits() != current.getVisits()) {
            return candidate.getVisits() > current.getVisits();
        }
        int byReward = Double.compare(candidate.meanReward(), current.meanReward());
        if (byReward != 0) {
            return byReward > 0;
        }
        return rank.get(candidate.getMove()) < rank.get(current.getMove());
    }

    @Override
    public void close() {
        if (workerPool != null) {
            workerPool.shutdownNow();
        }
    }
}
