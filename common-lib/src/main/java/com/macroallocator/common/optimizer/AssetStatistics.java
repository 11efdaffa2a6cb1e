package com.macroallocator.common.optimizer;

import com.macroallocator.common.model.Ticker;

import java.util.List;

/**
 * Annualized mean vector and covariance matrix of a candidate list.
 *
 * <p>Series of unequal length are aligned on their most recent observations: only the
 * last {@code min(len)} returns of every ticker are used. Daily moments are scaled by
 * {@value #PERIODS_PER_YEAR}. With fewer than two aligned observations every moment is 0.
 */
public final class AssetStatistics {

    public static final int PERIODS_PER_YEAR = 252;

    private final List<Ticker> tickers;
    private final double[] mean;
    private final double[][] covariance;
    private final int observations;

    private AssetStatistics(List<Ticker> tickers, double[] mean, double[][] covariance, int observations) {
        this.tickers = tickers;
        this.mean = mean;
        this.covariance = covariance;
        this.observations = observations;
    }

    public static AssetStatistics from(List<Ticker> tickers) {
        List<Ticker> assets = List.copyOf(tickers);
        int n = assets.size();
        int length = assets.stream().mapToInt(t -> t.returns().size()).min().orElse(0);

        double[][] aligned = new double[n][length];
        for (int i = 0; i < n; i++) {
            List<Double> r = assets.get(i).returns();
            int offset = r.size() - length;
            for (int d = 0; d < length; d++) {
                aligned[i][d] = r.get(offset + d);
            }
        }

        double[] mean = new double[n];
        double[][] cov = new double[n][n];
        if (length >= 2) {
            double[] dailyMean = new double[n];
            for (int i = 0; i < n; i++) {
                double sum = 0.0;
                for (int d = 0; d < length; d++) sum += aligned[i][d];
                dailyMean[i] = sum / length;
                mean[i] = dailyMean[i] * PERIODS_PER_YEAR;
            }
            for (int i = 0; i < n; i++) {
                for (int j = i; j < n; j++) {
                    double acc = 0.0;
                    for (int d = 0; d < length; d++) {
                        acc += (aligned[i][d] - dailyMean[i]) * (aligned[j][d] - dailyMean[j]);
                    }
                    double c = acc / (length - 1) * PERIODS_PER_YEAR;
                    cov[i][j] = c;
                    cov[j][i] = c;
                }
            }
        }
        return new AssetStatistics(assets, mean, cov, length);
    }

    public int size() {
        return tickers.size();
    }

    public Ticker ticker(int index) {
        return tickers.get(index);
    }

    public List<Ticker> tickers() {
        return tickers;
    }

    public double mean(int index) {
        return mean[index];
    }

    public double covariance(int i, int j) {
        return covariance[i][j];
    }

    /** Number of aligned daily observations behind the estimates. */
    public int observations() {
        return observations;
    }
}
