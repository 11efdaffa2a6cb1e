package com.macroallocator.common.model;

import java.util.List;

/**
 * Selected subset of the candidates with long-only weights.
 *
 * <p>{@code tickers}, {@code names} and {@code weights} are parallel lists. Weights sum
 * to 1 when the selection is non-empty and to 0 otherwise.
 *
 * @param expectedReturn annualized expected return of the weighted mix
 * @param volatility     annualized volatility estimate of the weighted mix
 * @param objective      regime-consistent score the solver maximized
 * @param feasible       whether the mix respects the regime's volatility ceiling
 */
public record PortfolioSelection(
    List<String> tickers,
    List<String> names,
    List<Double> weights,
    double expectedReturn,
    double volatility,
    double objective,
    boolean feasible
) {
    public PortfolioSelection {
        tickers = List.copyOf(tickers);
        names = List.copyOf(names);
        weights = List.copyOf(weights);
        if (tickers.size() != weights.size() || names.size() != weights.size()) {
            throw new IllegalArgumentException("tickers, names and weights must have equal length: "
                + tickers.size() + "/" + names.size() + "/" + weights.size());
        }
    }

    public static PortfolioSelection empty() {
        return new PortfolioSelection(List.of(), List.of(), List.of(), 0.0, 0.0, 0.0, true);
    }

    public boolean isEmpty() {
        return tickers.isEmpty();
    }

    public int size() {
        return tickers.size();
    }
}
