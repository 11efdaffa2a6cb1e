package com.macroallocator.common.optimizer;

import com.macroallocator.common.model.PortfolioSelection;

/**
 * Selection plus how it was obtained.
 *
 * @param solver            name of the solver that produced {@code selection}
 * @param exactTimedOut     true when the exact solver ran out of time and was replaced
 * @param evaluatedSubsets  distinct subsets whose weights were computed
 */
public record OptimizationOutcome(
    PortfolioSelection selection,
    String solver,
    boolean exactTimedOut,
    int evaluatedSubsets
) {}
