package com.virusbot.strategy;

import com.virusbot.model.Move;
import com.virusbot.model.TurnState;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Search tree node. Structure (untried moves, children) and statistics (visits, reward)
 * are guarded by the node's monitor, so several workers can share one tree.
 */
final class SearchNode {

    private final TurnState state;
    private final Move move;
    private final SearchNode parent;
    private final List<Move> untriedMoves;
    private final List<SearchNode> children = new ArrayList<>();

    private int visits;
    private double reward;
    private boolean exhausted;

    private SearchNode(TurnState state, Move move, SearchNode parent, int visits) {
        this.state = state;
        this.move = move;
        this.parent = parent;
        this.untriedMoves = state.isTerminal()
                ? new ArrayList<>()
                : new ArrayList<>(state.legalMovesForCurrentPlayer());
        this.visits = visits;
    }

    /**
     * A root counts its own creation as its first visit.
     */
    static SearchNode root(TurnState state) {
        return new SearchNode(state, null, null, 1);
    }

    TurnState getState() {
        return state;
    }

    Move getMove() {
        return move;
    }

    SearchNode getParent() {
        return parent;
    }

    synchronized int getVisits() {
        return visits;
    }

    synchronized double getReward() {
        return reward;
    }

    synchronized double meanReward() {
        return visits == 0 ? 0 : reward / visits;
    }

    synchronized List<SearchNode> getChildren() {
        return new ArrayList<>(children);
    }

    /**
     * No move left to expand and nothing expanded: a terminal state or a player
     * without legal moves.
     */
    synchronized boolean isLeaf() {
        return untriedMoves.isEmpty() && children.isEmpty();
    }

    /**
     * Nothing left to search below this node: it is a leaf, which its creator already
     * simulated, or every child is exhausted.
     */
    synchronized boolean isExhausted() {
        return exhausted || (untriedMoves.isEmpty() && children.isEmpty());
    }

    synchronized void markExhausted() {
        exhausted = true;
    }

    /**
     * Expands one random untried move, or returns {@code null} when all are expanded.
     */
    synchronized SearchNode expand(Random random) {
        if (untriedMoves.isEmpty()) {
            return null;
        }
        Move next = untriedMoves.remove(random.nextInt(untriedMoves.size()));
        SearchNode child = new SearchNode(state.apply(next), next, this, 0);
        children.add(child);
        return child;
    }

    /**
     * UCT choice among the children that are not exhausted; unvisited children win
     * outright. {@code null} when every child is exhausted.
     */
    synchronized SearchNode selectChild(double explorationConstant) {
        SearchNode best = null;
        double bestValue = Double.NEGATIVE_INFINITY;
        double logVisits = Math.log(Math.max(1, visits));
        for (SearchNode child : children) {
            if (child.isExhausted()) {
                continue;
            }
            int childVisits = child.getVisits();
            if (childVisits == 0) {
                return child;
            }
            double value = child.getReward() / childVisits
                    + explorationConstant * Math.sqrt(logVisits / childVisits);
            if (value > bestValue) {
                bestValue = value;
                best = child;
            }
        }
        return best;
    }

    synchronized void record(double value) {
        visits++;
        reward += value;
    }
}
