package com.macroallocator.common.model;

/**
 * Distributional risk of a selected portfolio.
 *
 * @param riskProbability probability of a negative horizon return, [0,1]
 * @param var             loss magnitude at the configured confidence, [0,1]
 * @param cvar            expected loss beyond {@code var}, {@code var <= cvar <= 1}
 * @param volatility      annualized standard deviation of portfolio returns
 * @param maxDrawdown     largest peak-to-trough decline of the portfolio path, [0,1]
 */
public record RiskMetrics(
    double riskProbability,
    double var,
    double cvar,
    double volatility,
    double maxDrawdown
) {
    public static final RiskMetrics ZERO = new RiskMetrics(0.0, 0.0, 0.0, 0.0, 0.0);
}
