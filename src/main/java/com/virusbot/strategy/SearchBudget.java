package com.virusbot.strategy;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Iteration cap and deadline shared by every action of one turn. Each action searches
 * within a {@link Slice}: an even share of whatever budget is still left.
 */
final class SearchBudget {

    private final long deadlineNanos;
    private final AtomicInteger remainingIterations;

    private SearchBudget(long deadlineNanos, int iterations) {
        this.deadlineNanos = deadlineNanos;
        this.remainingIterations = new AtomicInteger(iterations);
    }

    static SearchBudget start(int iterations, Duration timeLimit) {
        return new SearchBudget(System.nanoTime() + timeLimit.toNanos(), iterations);
    }

    int remainingIterations() {
        return remainingIterations.get();
    }

    boolean isExhausted() {
        return remainingIterations.get() <= 0 || System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * Share of the remaining budget for the next of {@code remainingActions} actions.
     */
    Slice slice(int remainingActions) {
        int actions = Math.max(1, remainingActions);
        long now = System.nanoTime();
        long timeLeft = Math.max(0, deadlineNanos - now);
        int iterationsLeft = Math.max(0, remainingIterations.get());
        int share = (iterationsLeft + actions - 1) / actions;
        return new Slice(now + timeLeft / actions, share);
    }

    final class Slice {
        private final long sliceDeadlineNanos;
        private final AtomicInteger iterations;

        private Slice(long sliceDeadlineNanos, int iterations) {
            this.sliceDeadlineNanos = sliceDeadlineNanos;
            this.iterations = new AtomicInteger(iterations);
        }

        /**
         * Claims one iteration; false once the slice or the whole budget is used up.
         */
        boolean tryAcquire() {
            if (System.nanoTime() - sliceDeadlineNanos >= 0) {
                return false;
            }
            if (iterations.getAndDecrement() <= 0) {
                return false;
            }
            if (remainingIterations.getAndDecrement() <= 0) {
                return false;
            }
            return true;
        }
    }
}
