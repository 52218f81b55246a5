package io.fnanalyzer.core.algebra;

import io.fnanalyzer.core.error.SolveBudgetExceededException;

/**
 * Limits for one symbolic solve attempt. Guards against pathological input such as
 * high-degree polynomials with huge coefficients.
 *
 * <p>Immutable and thread-safe.
 *
 * @param maxDegree     largest polynomial degree the solver accepts (default: 32)
 * @param maxIterations largest number of candidate tests and bisection steps per solve
 *                      (default: 100000)
 * @param maxSolveMs    wall-clock limit per solve in milliseconds (default: 250)
 */
public record SolveBudget(int maxDegree, int maxIterations, long maxSolveMs) {

    /** Default budget: degree 32, 100000 iterations, 250ms. */
    public static final SolveBudget DEFAULT = new SolveBudget(32, 100_000, 250);

    public SolveBudget {
        if (maxDegree <= 0) {
            throw new IllegalArgumentException("maxDegree must be positive, got: " + maxDegree);
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive, got: " + maxIterations);
        }
        if (maxSolveMs <= 0) {
            throw new IllegalArgumentException("maxSolveMs must be positive, got: " + maxSolveMs);
        }
    }

    /** Starts tracking one solve attempt. */
    public Tracker start(String operation) {
        return new Tracker(operation);
    }

    /** Counts the work of one solve attempt. Not thread-safe; one per attempt. */
    public final class Tracker {

        private final String operation;
        private final long deadline;
        private int iterations;

        private Tracker(String operation) {
            this.operation = operation;
            this.deadline = System.nanoTime() + maxSolveMs * 1_000_000L;
        }

        /** @throws SolveBudgetExceededException if the degree is above the limit */
        public void requireDegree(int degree) {
            if (degree > maxDegree) {
                throw new SolveBudgetExceededException(
                        operation + ": degree " + degree + " exceeds the limit of " + maxDegree);
            }
        }

        /** Records one unit of work. @throws SolveBudgetExceededException when a limit is hit */
        public void tick() {
            iterations++;
            if (iterations > maxIterations) {
                throw new SolveBudgetExceededException(
                        operation + ": exceeded " + maxIterations + " iterations");
            }
            if ((iterations & 0xFF) == 0 && System.nanoTime() > deadline) {
                throw new SolveBudgetExceededException(operation + ": exceeded " + maxSolveMs + "ms");
            }
        }

        public int iterations() {
            return iterations;
        }
    }
}
