package com.macroallocator.common.risk;

import com.macroallocator.common.exception.InternalException;
import com.macroallocator.common.model.PortfolioSelection;
import com.macroallocator.common.model.RiskMetrics;
import com.macroallocator.common.model.Ticker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Forward-looking risk of a weighted selection.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Historical portfolio path: {@code Σ wᵢ·rᵢ} over the tail-aligned daily series.</li>
 *   <li>Bootstrap {@code paths} horizons of {@code horizonDays} days by resampling that path
 *       with a seeded generator; each horizon compounds to one outcome.</li>
 *   <li>riskProbability = share of outcomes below zero.</li>
 *   <li>VaR = loss at the m-th worst outcome, m = ⌈(1 − confidence)·paths⌉, floored at 0.</li>
 *   <li>CVaR = mean loss of the m worst outcomes, never below VaR.</li>
 *   <li>volatility and max drawdown come from the historical path.</li>
 * </ol>
 *
 * <p>All probabilities and losses are clipped to [0,1]. The same selection, series and
 * seed always produce identical metrics. Stateless and thread-safe.
 */
public class RiskAnalyzer {

    private static final String COMPONENT = "RiskAnalyzer";

    public static final long   DEFAULT_SEED         = 42L;
    public static final int    DEFAULT_PATHS        = 2_000;
    public static final int    DEFAULT_HORIZON_DAYS = 252;
    public static final double DEFAULT_CONFIDENCE   = 0.95;

    private static final int PERIODS_PER_YEAR = 252;

    private final long seed;
    private final int paths;
    private final int horizonDays;
    private final double confidence;

    public RiskAnalyzer() {
        this(DEFAULT_SEED, DEFAULT_PATHS, DEFAULT_HORIZON_DAYS, DEFAULT_CONFIDENCE);
    }

    public RiskAnalyzer(long seed, int paths, int horizonDays, double confidence) {
        if (paths < 1 || horizonDays < 1) {
            throw new IllegalArgumentException("paths and horizonDays must be positive");
        }
        if (!(confidence > 0.0 && confidence < 1.0)) {
            throw new IllegalArgumentException("confidence must be in (0,1): " + confidence);
        }
        this.seed = seed;
        this.paths = paths;
        this.horizonDays = horizonDays;
        this.confidence = confidence;
    }

    /**
     * @param selection weighted selection; empty yields {@link RiskMetrics#ZERO}
     * @param series    tickers carrying the return series of every selected symbol
     * @throws InternalException when a selected symbol has no series
     */
    public RiskMetrics analyze(PortfolioSelection selection, List<Ticker> series) {
        if (selection == null || selection.isEmpty()) {
            return RiskMetrics.ZERO;
        }

        Map<String, Ticker> bySymbol = series.stream()
            .collect(Collectors.toMap(Ticker::symbol, Function.identity(), (a, b) -> a));
        List<List<Double>> selected = new ArrayList<>();
        for (String symbol : selection.tickers()) {
            Ticker t = bySymbol.get(symbol);
            if (t == null) {
                throw new InternalException(COMPONENT, "no return series for selected ticker " + symbol);
            }
            selected.add(t.returns());
        }

        double[] history = ReturnStatistics.weightedTail(selected, selection.weights());
        if (history.length == 0) {
            return RiskMetrics.ZERO;
        }

        double[] outcomes = simulate(history);
        Arrays.sort(outcomes);

        int tail = Math.max(1, (int) Math.ceil((1.0 - confidence) * paths - 1e-9));
        double var = Math.max(0.0, -outcomes[tail - 1]);

        double tailSum = 0.0;
        for (int i = 0; i < tail; i++) tailSum += outcomes[i];
        double cvar = Math.max(var, -tailSum / tail);

        int losing = 0;
        for (double o : outcomes) if (o < 0.0) losing++;

        return new RiskMetrics(
            clip((double) losing / paths),
            clip(var),
            clip(cvar),
            Math.max(0.0, ReturnStatistics.annualizedVolatility(history, PERIODS_PER_YEAR)),
            clip(ReturnStatistics.maxDrawdown(history))
        );
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private double[] simulate(double[] history) {
        Random random = new Random(seed);
        double[] outcomes = new double[paths];
        for (int p = 0; p < paths; p++) {
            double growth = 1.0;
            for (int d = 0; d < horizonDays; d++) {
                growth *= 1.0 + history[random.nextInt(history.length)];
            }
            outcomes[p] = growth - 1.0;
        }
        return outcomes;
    }

    private static double clip(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
