package com.macroallocator.common.risk;

import java.util.List;

/**
 * Pure calculation utilities over daily simple-return series.
 * Input series are expected oldest-first.
 */
public final class ReturnStatistics {

    private ReturnStatistics() {}

    // ── compounding ─────────────────────────────────────────────────────────

    /** Π(1+r) − 1 over the whole array. */
    public static double compound(double[] returns) {
        double growth = 1.0;
        for (double r : returns) growth *= 1.0 + r;
        return growth - 1.0;
    }

    // ── dispersion ──────────────────────────────────────────────────────────

    /**
     * Sample standard deviation scaled by √periodsPerYear.
     * @return 0 when fewer than two observations
     */
    public static double annualizedVolatility(double[] returns, int periodsPerYear) {
        int n = returns.length;
        if (n < 2) return 0.0;
        double mean = 0.0;
        for (double r : returns) mean += r;
        mean /= n;
        double ss = 0.0;
        for (double r : returns) ss += (r - mean) * (r - mean);
        return Math.sqrt(ss / (n - 1)) * Math.sqrt(periodsPerYear);
    }

    // ── drawdown ────────────────────────────────────────────────────────────

    /**
     * Largest peak-to-trough decline of the cumulative wealth path that starts at 1.0.
     * @return fraction in [0,1]; 0 for an empty or monotonically rising path
     */
    public static double maxDrawdown(double[] returns) {
        double wealth = 1.0;
        double peak = 1.0;
        double maxDrawdown = 0.0;
        for (double r : returns) {
            wealth *= 1.0 + r;
            if (wealth > peak) {
                peak = wealth;
            }
            double drawdown = (peak - wealth) / peak;
            if (drawdown > maxDrawdown) {
                maxDrawdown = drawdown;
            }
        }
        return maxDrawdown;
    }

    // ── alignment ───────────────────────────────────────────────────────────

    /** Weighted sum of the last {@code min(len)} observations of each series. */
    public static double[] weightedTail(List<List<Double>> series, List<Double> weights) {
        int length = series.stream().mapToInt(List::size).min().orElse(0);
        double[] out = new double[length];
        for (int i = 0; i < series.size(); i++) {
            List<Double> s = series.get(i);
            double w = weights.get(i);
            int offset = s.size() - length;
            for (int d = 0; d < length; d++) {
                out[d] += w * s.get(offset + d);
            }
        }
        return out;
    }
}
