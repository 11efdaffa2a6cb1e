package com.macroallocator.common.model;

import java.util.List;

/**
 * One tradable asset of the candidate universe.
 *
 * @param symbol    unique key, upper case
 * @param name      display name
 * @param sector    sector tag used by the regime tilt filter
 * @param returns   daily simple returns, oldest first
 * @param synthetic true when {@code returns} was simulated because the upstream source was unavailable
 */
public record Ticker(
    String symbol,
    String name,
    String sector,
    List<Double> returns,
    boolean synthetic
) {
    public Ticker {
        returns = returns == null ? List.of() : List.copyOf(returns);
    }

    /** Compounded return over the whole series. */
    public double oneYearReturn() {
        double growth = 1.0;
        for (double r : returns) {
            growth *= 1.0 + r;
        }
        return growth - 1.0;
    }
}
