package com.macroallocator.common.optimizer;

import com.macroallocator.common.model.PortfolioSelection;
import com.macroallocator.common.model.Ticker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One optimization request: candidate statistics, the regime's risk profile and the
 * cardinality cap. Subset evaluations are memoized, so an instance belongs to a single
 * optimization run and is not thread-safe.
 */
public final class OptimizationProblem {

    private final AssetStatistics stats;
    private final RegimeRiskProfile profile;
    private final int maxAssets;
    private final SubsetWeightSolver weightSolver;
    private final Map<String, SubsetEvaluation> memo = new HashMap<>();

    public OptimizationProblem(AssetStatistics stats, RegimeRiskProfile profile, int maxAssets) {
        if (maxAssets < 1) {
            throw new IllegalArgumentException("maxAssets must be at least 1: " + maxAssets);
        }
        this.stats = stats;
        this.profile = profile;
        this.maxAssets = maxAssets;
        this.weightSolver = new SubsetWeightSolver(stats, profile);
    }

    public int candidateCount() {
        return stats.size();
    }

    /** Largest subset size worth searching: the cap, bounded by the candidate count. */
    public int maxAssets() {
        return Math.min(maxAssets, stats.size());
    }

    public RegimeRiskProfile profile() {
        return profile;
    }

    /** Evaluates the given candidate indices; order does not matter. */
    public SubsetEvaluation evaluate(int[] subset) {
        int[] sorted = subset.clone();
        Arrays.sort(sorted);
        return memo.computeIfAbsent(Arrays.toString(sorted), k -> weightSolver.evaluate(sorted));
    }

    public int evaluatedSubsets() {
        return memo.size();
    }

    /** Converts an evaluation to the public selection, heaviest weight first. */
    public PortfolioSelection toSelection(SubsetEvaluation evaluation) {
        if (evaluation == null || evaluation.cardinality() == 0) {
            return PortfolioSelection.empty();
        }
        Integer[] order = new Integer[evaluation.cardinality()];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> {
            int byWeight = Double.compare(evaluation.weights()[b], evaluation.weights()[a]);
            if (byWeight != 0) return byWeight;
            return symbolAt(evaluation, a).compareTo(symbolAt(evaluation, b));
        });

        List<String> tickers = new ArrayList<>();
        List<String> names = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        for (int i : order) {
            Ticker t = stats.ticker(evaluation.members()[i]);
            tickers.add(t.symbol());
            names.add(t.name());
            weights.add(evaluation.weights()[i]);
        }
        return new PortfolioSelection(tickers, names, weights, evaluation.expectedReturn(),
            evaluation.volatility(), evaluation.objective(), evaluation.feasible());
    }

    private String symbolAt(SubsetEvaluation evaluation, int position) {
        return stats.ticker(evaluation.members()[position]).symbol();
    }
}
