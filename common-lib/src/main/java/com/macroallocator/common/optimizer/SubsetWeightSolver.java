package com.macroallocator.common.optimizer;

import java.util.Arrays;

/**
 * Long-only weights for a fixed subset of assets.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Maximize {@code w·μ − λ·wᵀΣw} over the probability simplex by projected-gradient
 *       ascent, starting from equal weights.</li>
 *   <li>If the resulting volatility exceeds the regime ceiling, compute the minimum-variance
 *       mix. If that still exceeds the ceiling the subset is infeasible and keeps the
 *       minimum-variance weights.</li>
 *   <li>Otherwise raise λ geometrically until the ceiling holds, then bisect λ in log space
 *       and keep the smallest feasible λ found.</li>
 *   <li>Weights below {@value #PRUNE_THRESHOLD} are dropped and the rest renormalized.</li>
 * </ol>
 *
 * <p>The reported objective always uses the profile's own λ so subsets stay comparable.
 * Stateless and thread-safe.
 */
public final class SubsetWeightSolver {

    static final double PRUNE_THRESHOLD = 1e-6;

    private static final int    MAX_ITERATIONS    = 2_000;
    private static final double CONVERGENCE       = 1e-10;
    private static final int    MAX_DOUBLINGS     = 40;
    private static final int    BISECTION_STEPS   = 30;
    private static final double CEILING_TOLERANCE = 1e-9;

    private final AssetStatistics stats;
    private final RegimeRiskProfile profile;

    public SubsetWeightSolver(AssetStatistics stats, RegimeRiskProfile profile) {
        this.stats = stats;
        this.profile = profile;
    }

    public SubsetEvaluation evaluate(int[] subset) {
        int k = subset.length;
        double[] mu = new double[k];
        double[][] sigma = new double[k][k];
        for (int a = 0; a < k; a++) {
            mu[a] = stats.mean(subset[a]);
            for (int b = 0; b < k; b++) {
                sigma[a][b] = stats.covariance(subset[a], subset[b]);
            }
        }

        double ceiling = profile.volatilityCeiling();
        double[] weights = maximize(mu, sigma, profile.riskAversion());
        boolean feasible = true;

        if (volatility(weights, sigma) > ceiling + CEILING_TOLERANCE) {
            double[] minVariance = maximize(new double[k], sigma, 1.0);
            if (volatility(minVariance, sigma) > ceiling + CEILING_TOLERANCE) {
                weights = minVariance;
                feasible = false;
            } else {
                weights = tightenUntilFeasible(mu, sigma, ceiling, minVariance);
            }
        }

        return summarize(subset, prune(weights), mu, sigma, feasible);
    }

    // ── risk-aversion search ───────────────────────────────────────────────

    private double[] tightenUntilFeasible(double[] mu, double[][] sigma, double ceiling, double[] minVariance) {
        double low = profile.riskAversion();
        double high = low;
        double[] feasibleWeights = null;
        for (int i = 0; i < MAX_DOUBLINGS; i++) {
            high *= 2.0;
            double[] w = maximize(mu, sigma, high);
            if (volatility(w, sigma) <= ceiling + CEILING_TOLERANCE) {
                feasibleWeights = w;
                break;
            }
            low = high;
        }
        if (feasibleWeights == null) {
            return minVariance;
        }

        double logLow = Math.log(low);
        double logHigh = Math.log(high);
        for (int i = 0; i < BISECTION_STEPS; i++) {
            double mid = Math.exp((logLow + logHigh) / 2.0);
            double[] w = maximize(mu, sigma, mid);
            if (volatility(w, sigma) <= ceiling + CEILING_TOLERANCE) {
                feasibleWeights = w;
                logHigh = Math.log(mid);
            } else {
                logLow = Math.log(mid);
            }
        }
        return feasibleWeights;
    }

    // ── projected gradient ascent ──────────────────────────────────────────

    static double[] maximize(double[] mu, double[][] sigma, double lambda) {
        int k = mu.length;
        double[] w = new double[k];
        Arrays.fill(w, 1.0 / k);
        if (k == 1) {
            return w;
        }

        // 1 / Lipschitz bound of the gradient, via the largest absolute row sum of Σ
        double rowSumMax = 0.0;
        for (double[] row : sigma) {
            double s = 0.0;
            for (double v : row) s += Math.abs(v);
            rowSumMax = Math.max(rowSumMax, s);
        }
        double lipschitz = 2.0 * lambda * rowSumMax;
        double step = lipschitz > 1e-12 ? 1.0 / lipschitz : 1.0;

        double[] next = new double[k];
        for (int iter = 0; iter < MAX_ITERATIONS; iter++) {
            for (int a = 0; a < k; a++) {
                double sigmaW = 0.0;
                for (int b = 0; b < k; b++) sigmaW += sigma[a][b] * w[b];
                next[a] = w[a] + step * (mu[a] - 2.0 * lambda * sigmaW);
            }
            projectOntoSimplex(next);

            double delta = 0.0;
            for (int a = 0; a < k; a++) {
                delta = Math.max(delta, Math.abs(next[a] - w[a]));
                w[a] = next[a];
            }
            if (delta < CONVERGENCE) {
                break;
            }
        }
        return w;
    }

    /** Euclidean projection onto {w ≥ 0, Σw = 1}, in place. */
    static void projectOntoSimplex(double[] v) {
        int k = v.length;
        double[] sorted = v.clone();
        Arrays.sort(sorted);

        double cumulative = 0.0;
        double theta = 0.0;
        for (int i = k - 1; i >= 0; i--) {
            cumulative += sorted[i];
            double candidate = (cumulative - 1.0) / (k - i);
            if (i == 0 || sorted[i - 1] <= candidate) {
                theta = candidate;
                break;
            }
        }
        for (int a = 0; a < k; a++) {
            v[a] = Math.max(0.0, v[a] - theta);
        }
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static double[] prune(double[] weights) {
        double[] out = weights.clone();
        double total = 0.0;
        for (int a = 0; a < out.length; a++) {
            if (out[a] < PRUNE_THRESHOLD) out[a] = 0.0;
            total += out[a];
        }
        if (total <= 0.0) {
            Arrays.fill(out, 1.0 / out.length);
            return out;
        }
        for (int a = 0; a < out.length; a++) out[a] /= total;
        return out;
    }

    private SubsetEvaluation summarize(int[] subset, double[] weights, double[] mu,
                                       double[][] sigma, boolean feasible) {
        double expected = 0.0;
        for (int a = 0; a < weights.length; a++) expected += weights[a] * mu[a];
        double variance = variance(weights, sigma);
        double objective = expected - profile.riskAversion() * variance;

        int kept = 0;
        for (double w : weights) if (w > 0.0) kept++;
        int[] members = new int[kept];
        double[] memberWeights = new double[kept];
        int m = 0;
        for (int a = 0; a < weights.length; a++) {
            if (weights[a] > 0.0) {
                members[m] = subset[a];
                memberWeights[m] = weights[a];
                m++;
            }
        }
        return new SubsetEvaluation(members, memberWeights, expected, Math.sqrt(variance),
            objective, feasible, keyOf(members));
    }

    String keyOf(int[] members) {
        String[] symbols = new String[members.length];
        for (int i = 0; i < members.length; i++) {
            symbols[i] = stats.ticker(members[i]).symbol();
        }
        Arrays.sort(symbols);
        return String.join(",", symbols);
    }

    private static double variance(double[] w, double[][] sigma) {
        double v = 0.0;
        for (int a = 0; a < w.length; a++) {
            for (int b = 0; b < w.length; b++) {
                v += w[a] * sigma[a][b] * w[b];
            }
        }
        return Math.max(0.0, v);
    }

    private static double volatility(double[] w, double[][] sigma) {
        return Math.sqrt(variance(w, sigma));
    }
}
