package com.macroallocator.common.optimizer;

import com.macroallocator.common.model.PortfolioSelection;

/**
 * Strategy contract for choosing the best subset of candidates and its weights.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>      : all per-run state lives in the {@link OptimizationProblem}</li>
 *   <li><b>Pure</b>           : no logging, no reactive types</li>
 *   <li><b>Deterministic</b>  : same problem, same answer</li>
 * </ul>
 *
 * <p>Current implementations: {@link ExactPortfolioSolver} (full enumeration) and
 * {@link LocalSearchPortfolioSolver} (greedy build + local search). Both rank subsets with
 * {@link SelectionOrdering}. {@link PortfolioOptimizer} decides which one runs.
 */
public interface PortfolioSolver {

    /**
     * @return best selection found; {@link PortfolioSelection#empty()} when the problem has
     *         no candidates
     * @throws java.util.concurrent.CancellationException when the deadline is cancelled
     * @throws com.macroallocator.common.exception.OptimizationTimeoutException when the
     *         solver honours expiry and the deadline passes before it finishes
     */
    PortfolioSelection solve(OptimizationProblem problem, SolverDeadline deadline);

    /** Short identifier used in logs. */
    String name();
}
