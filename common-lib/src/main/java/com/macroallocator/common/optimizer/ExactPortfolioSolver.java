package com.macroallocator.common.optimizer;

import com.macroallocator.common.exception.OptimizationTimeoutException;
import com.macroallocator.common.model.PortfolioSelection;

/**
 * Enumerates every subset of size 1..maxAssets and keeps the best under
 * {@link SelectionOrdering}. Gives up with {@link OptimizationTimeoutException} once the
 * deadline expires.
 */
public class ExactPortfolioSolver implements PortfolioSolver {

    private static final String COMPONENT = "ExactPortfolioSolver";

    @Override
    public PortfolioSelection solve(OptimizationProblem problem, SolverDeadline deadline) {
        int n = problem.candidateCount();
        if (n == 0) {
            return PortfolioSelection.empty();
        }

        SubsetEvaluation best = null;
        long evaluated = 0;
        for (int size = 1; size <= problem.maxAssets(); size++) {
            int[] combination = new int[size];
            for (int i = 0; i < size; i++) combination[i] = i;

            do {
                deadline.checkCancelled();
                if (deadline.isExpired()) {
                    throw new OptimizationTimeoutException(COMPONENT, evaluated);
                }
                SubsetEvaluation candidate = problem.evaluate(combination);
                evaluated++;
                if (SelectionOrdering.INSTANCE.isBetter(candidate, best)) {
                    best = candidate;
                }
            } while (nextCombination(combination, n));
        }
        return problem.toSelection(best);
    }

    @Override
    public String name() {
        return "exact";
    }

    /** Advances to the next k-combination of {0..n-1} in lexicographic order. */
    static boolean nextCombination(int[] combination, int n) {
        int k = combination.length;
        int i = k - 1;
        while (i >= 0 && combination[i] == n - k + i) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        combination[i]++;
        for (int j = i + 1; j < k; j++) {
            combination[j] = combination[j - 1] + 1;
        }
        return true;
    }
}
