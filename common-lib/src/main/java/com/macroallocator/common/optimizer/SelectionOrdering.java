package com.macroallocator.common.optimizer;

import java.util.Comparator;

/**
 * Total order over evaluated subsets, best first.
 *
 * <ol>
 *   <li>feasible before infeasible</li>
 *   <li>feasible: higher objective, then lower volatility</li>
 *   <li>infeasible: lower volatility</li>
 *   <li>fewer members</li>
 *   <li>lexicographically smaller sorted symbol list</li>
 * </ol>
 */
public final class SelectionOrdering implements Comparator<SubsetEvaluation> {

    public static final SelectionOrdering INSTANCE = new SelectionOrdering();

    private SelectionOrdering() {}

    @Override
    public int compare(SubsetEvaluation a, SubsetEvaluation b) {
        if (a.feasible() != b.feasible()) {
            return a.feasible() ? -1 : 1;
        }
        if (a.feasible()) {
            int byObjective = Double.compare(b.objective(), a.objective());
            if (byObjective != 0) return byObjective;
        }
        int byVolatility = Double.compare(a.volatility(), b.volatility());
        if (byVolatility != 0) return byVolatility;

        int byCardinality = Integer.compare(a.cardinality(), b.cardinality());
        if (byCardinality != 0) return byCardinality;

        return a.key().compareTo(b.key());
    }

    /** True when {@code candidate} strictly beats {@code incumbent}; a null incumbent always loses. */
    public boolean isBetter(SubsetEvaluation candidate, SubsetEvaluation incumbent) {
        return incumbent == null || compare(candidate, incumbent) < 0;
    }
}
