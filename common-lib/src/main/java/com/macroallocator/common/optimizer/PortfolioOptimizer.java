package com.macroallocator.common.optimizer;

import com.macroallocator.common.exception.OptimizationTimeoutException;
import com.macroallocator.common.model.PortfolioSelection;
import com.macroallocator.common.model.Regime;
import com.macroallocator.common.model.Ticker;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks a subset of at most {@code maxAssets} candidates and their long-only weights,
 * maximizing the regime-consistent objective {@code w·μ − λ·wᵀΣw} under the regime's
 * volatility ceiling (see {@link RegimeRiskProfile}).
 *
 * <p>Solver choice:
 * <ul>
 *   <li>candidates &gt; {@code enumerationThreshold} → approximate solver</li>
 *   <li>otherwise exact solver; on {@link OptimizationTimeoutException} → approximate solver</li>
 * </ul>
 *
 * <p>Duplicate symbols are collapsed to their first occurrence. An empty candidate list
 * yields {@link PortfolioSelection#empty()}. Stateless and thread-safe.
 */
public class PortfolioOptimizer {

    public static final int DEFAULT_MAX_ASSETS = 4;
    public static final int DEFAULT_ENUMERATION_THRESHOLD = 16;

    private final PortfolioSolver exactSolver;
    private final PortfolioSolver approximateSolver;
    private final int maxAssets;
    private final int enumerationThreshold;

    public PortfolioOptimizer() {
        this(new ExactPortfolioSolver(), new LocalSearchPortfolioSolver(),
             DEFAULT_MAX_ASSETS, DEFAULT_ENUMERATION_THRESHOLD);
    }

    public PortfolioOptimizer(PortfolioSolver exactSolver, PortfolioSolver approximateSolver,
                              int maxAssets, int enumerationThreshold) {
        if (maxAssets < 1) {
            throw new IllegalArgumentException("maxAssets must be at least 1: " + maxAssets);
        }
        this.exactSolver = exactSolver;
        this.approximateSolver = approximateSolver;
        this.maxAssets = maxAssets;
        this.enumerationThreshold = enumerationThreshold;
    }

    public PortfolioSelection optimize(List<Ticker> candidates, Regime regime) {
        return optimize(candidates, regime, SolverDeadline.unbounded()).selection();
    }

    public OptimizationOutcome optimize(List<Ticker> candidates, Regime regime, SolverDeadline deadline) {
        List<Ticker> unique = distinct(candidates);
        if (unique.isEmpty()) {
            return new OptimizationOutcome(PortfolioSelection.empty(), "none", false, 0);
        }

        OptimizationProblem problem = new OptimizationProblem(
            AssetStatistics.from(unique), RegimeRiskProfile.forRegime(regime), maxAssets);

        if (unique.size() > enumerationThreshold) {
            PortfolioSelection selection = approximateSolver.solve(problem, deadline);
            return new OptimizationOutcome(selection, approximateSolver.name(), false, problem.evaluatedSubsets());
        }

        try {
            PortfolioSelection selection = exactSolver.solve(problem, deadline);
            return new OptimizationOutcome(selection, exactSolver.name(), false, problem.evaluatedSubsets());
        } catch (OptimizationTimeoutException e) {
            PortfolioSelection selection = approximateSolver.solve(problem, deadline);
            return new OptimizationOutcome(selection, approximateSolver.name(), true, problem.evaluatedSubsets());
        }
    }

    private static List<Ticker> distinct(List<Ticker> candidates) {
        if (candidates == null) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<Ticker> out = new ArrayList<>();
        for (Ticker t : candidates) {
            if (seen.add(t.symbol())) {
                out.add(t);
            }
        }
        return out;
    }
}
