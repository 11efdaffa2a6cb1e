package com.macroallocator.common.universe;

import com.macroallocator.common.model.Ticker;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Simulated daily returns for tickers whose market data could not be fetched.
 *
 * <p>Each series is a geometric random walk: annual drift drawn uniformly from
 * [5%, 15%], annual volatility from [15%, 35%], daily log-returns normal with the
 * matching per-day moments. The generator is seeded per symbol, so a given symbol
 * always produces the same series for a given base seed.
 */
public class SyntheticSeriesGenerator {

    public static final long DEFAULT_SEED = 42L;
    public static final int TRADING_DAYS = 252;

    private static final double MIN_DRIFT = 0.05;
    private static final double MAX_DRIFT = 0.15;
    private static final double MIN_VOL   = 0.15;
    private static final double MAX_VOL   = 0.35;

    private final long seed;
    private final int length;

    public SyntheticSeriesGenerator() {
        this(DEFAULT_SEED, TRADING_DAYS);
    }

    public SyntheticSeriesGenerator(long seed, int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive: " + length);
        }
        this.seed = seed;
        this.length = length;
    }

    public List<Double> returnsFor(String symbol) {
        Random random = new Random(seed * 31 + symbol.hashCode());
        double drift = MIN_DRIFT + (MAX_DRIFT - MIN_DRIFT) * random.nextDouble();
        double vol   = MIN_VOL + (MAX_VOL - MIN_VOL) * random.nextDouble();

        double dailyVol   = vol / Math.sqrt(TRADING_DAYS);
        double dailyDrift = (drift - 0.5 * vol * vol) / TRADING_DAYS;

        List<Double> returns = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            double logReturn = dailyDrift + dailyVol * random.nextGaussian();
            returns.add(Math.expm1(logReturn));
        }
        return returns;
    }

    public Ticker synthesize(TickerDefinition definition) {
        return new Ticker(definition.symbol(), definition.name(), definition.sector(),
            returnsFor(definition.symbol()), true);
    }
}
