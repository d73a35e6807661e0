package com.example.riskintel.propagation;

/**
 * Step and wall-clock allowance for one traversal.
 */
final class TraversalBudget {

    private final int maxSteps;
    private final long deadlineNanos;
    private int steps;
    private String exhaustedReason;

    TraversalBudget(int maxSteps, long timeBudgetMs) {
        this.maxSteps = maxSteps;
        this.deadlineNanos = System.nanoTime() + Math.max(0, timeBudgetMs) * 1_000_000L;
    }

    /** Takes one step, or returns false once the budget is spent. */
    boolean tryConsume() {
        if (steps >= maxSteps) {
            exhaustedReason = "step budget of " + maxSteps + " exhausted";
            return false;
        }
        if (System.nanoTime() - deadlineNanos > 0) {
            exhaustedReason = "time budget exhausted after " + steps + " steps";
            return false;
        }
        steps++;
        return true;
    }

    int stepsUsed() {
        return steps;
    }

    String exhaustedReason() {
        return exhaustedReason;
    }
}
