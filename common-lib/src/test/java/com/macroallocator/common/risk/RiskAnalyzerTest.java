package com.macroallocator.common.risk;

import com.macroallocator.common.exception.InternalException;
import com.macroallocator.common.model.PortfolioSelection;
import com.macroallocator.common.model.RiskMetrics;
import com.macroallocator.common.model.Ticker;
import com.macroallocator.common.universe.SyntheticSeriesGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link RiskAnalyzer} and {@link ReturnStatistics}.
 */
class RiskAnalyzerTest {

    private static final SyntheticSeriesGenerator GENERATOR = new SyntheticSeriesGenerator();

    private final RiskAnalyzer analyzer = new RiskAnalyzer();

    private static Ticker ticker(String symbol) {
        return new Ticker(symbol, symbol, "Test", GENERATOR.returnsFor(symbol), false);
    }

    private static Ticker constant(String symbol, double dailyReturn) {
        return new Ticker(symbol, symbol, "Test", Collections.nCopies(252, dailyReturn), false);
    }

    private static PortfolioSelection selection(List<String> tickers, List<Double> weights) {
        return new PortfolioSelection(tickers, tickers, weights, 0.0, 0.0, 0.0, true);
    }

    private static void assertWellFormed(RiskMetrics m) {
        assertTrue(m.var() >= 0.0, "var " + m.var());
        assertTrue(m.cvar() >= m.var(), "cvar " + m.cvar() + " < var " + m.var());
        assertTrue(m.riskProbability() >= 0.0 && m.riskProbability() <= 1.0);
        assertTrue(m.var() <= 1.0 && m.cvar() <= 1.0);
        assertTrue(m.maxDrawdown() >= 0.0 && m.maxDrawdown() <= 1.0);
        assertTrue(m.volatility() >= 0.0);
    }

    // ── analyze() ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("analyze()")
    class Analyze {

        @Test
        @DisplayName("empty selection → all zeros")
        void emptySelection() {
            assertEquals(RiskMetrics.ZERO, analyzer.analyze(PortfolioSelection.empty(), List.of()));
        }

        @Test
        @DisplayName("same selection, series and seed → identical metrics")
        void deterministic() {
            List<Ticker> series = List.of(ticker("GLD"), ticker("XLU"), ticker("KO"));
            PortfolioSelection s = selection(List.of("GLD", "XLU", "KO"), List.of(0.5, 0.3, 0.2));
            RiskMetrics first = analyzer.analyze(s, series);
            RiskMetrics second = analyzer.analyze(s, series);
            assertEquals(first, second);
            assertEquals(first, new RiskAnalyzer().analyze(s, series));
        }

        @Test
        @DisplayName("cvar ≥ var ≥ 0 and every metric in range")
        void wellFormed() {
            String[] symbols = {"NVDA", "TSLA", "COIN", "SPY", "TLT", "PG"};
            List<Ticker> series = new ArrayList<>();
            for (String s : symbols) series.add(ticker(s));

            for (int i = 0; i < symbols.length; i++) {
                RiskMetrics single = analyzer.analyze(selection(List.of(symbols[i]), List.of(1.0)), series);
                assertWellFormed(single);
            }
            RiskMetrics mix = analyzer.analyze(
                selection(List.of("NVDA", "TLT", "PG"), List.of(0.2, 0.5, 0.3)), series);
            assertWellFormed(mix);
        }

        @Test
        @DisplayName("steadily rising asset → no loss risk")
        void risingAsset() {
            RiskMetrics m = analyzer.analyze(selection(List.of("UP"), List.of(1.0)), List.of(constant("UP", 0.001)));
            assertEquals(0.0, m.riskProbability());
            assertEquals(0.0, m.var());
            assertEquals(0.0, m.cvar());
            assertEquals(0.0, m.maxDrawdown());
            assertEquals(0.0, m.volatility(), 1e-12);
        }

        @Test
        @DisplayName("steadily falling asset → certain loss")
        void fallingAsset() {
            RiskMetrics m = analyzer.analyze(selection(List.of("DOWN"), List.of(1.0)), List.of(constant("DOWN", -0.01)));
            double loss = 1.0 - Math.pow(0.99, 252);
            assertEquals(1.0, m.riskProbability());
            assertEquals(loss, m.var(), 1e-9);
            assertEquals(loss, m.cvar(), 1e-9);
            assertEquals(loss, m.maxDrawdown(), 1e-9);
        }

        @Test
        @DisplayName("selected symbol without series → InternalException")
        void missingSeries() {
            assertThrows(InternalException.class,
                () -> analyzer.analyze(selection(List.of("GHOST"), List.of(1.0)), List.of(ticker("GLD"))));
        }

        @Test
        @DisplayName("different seeds may differ, each stays well formed")
        void otherSeed() {
            List<Ticker> series = List.of(ticker("AMD"));
            PortfolioSelection s = selection(List.of("AMD"), List.of(1.0));
            assertWellFormed(new RiskAnalyzer(7L, 500, 126, 0.99).analyze(s, series));
        }

        @Test
        @DisplayName("invalid configuration is rejected")
        void invalidConfig() {
            assertThrows(IllegalArgumentException.class, () -> new RiskAnalyzer(1L, 0, 252, 0.95));
            assertThrows(IllegalArgumentException.class, () -> new RiskAnalyzer(1L, 100, 252, 1.0));
        }
    }

    // ── ReturnStatistics ──────────────────────────────────────────────────

    @Nested
    @DisplayName("ReturnStatistics")
    class Statistics {

        @Test
        @DisplayName("max drawdown is measured from the running peak")
        void maxDrawdown() {
            assertEquals(0.5, ReturnStatistics.maxDrawdown(new double[]{0.1, -0.5, 0.2}), 1e-12);
            assertEquals(0.0, ReturnStatistics.maxDrawdown(new double[]{}));
        }

        @Test
        @DisplayName("compound multiplies growth factors")
        void compound() {
            assertEquals(0.21, ReturnStatistics.compound(new double[]{0.1, 0.1}), 1e-12);
        }

        @Test
        @DisplayName("weighted tail aligns series on their latest observations")
        void weightedTail() {
            double[] path = ReturnStatistics.weightedTail(
                List.of(List.of(9.0, 0.1, 0.2), List.of(0.3, 0.4)), List.of(0.5, 0.5));
            assertArrayEquals(new double[]{0.2, 0.3}, path, 1e-12);
        }

        @Test
        @DisplayName("volatility needs two observations")
        void volatility() {
            assertEquals(0.0, ReturnStatistics.annualizedVolatility(new double[]{0.01}, 252));
            assertTrue(ReturnStatistics.annualizedVolatility(new double[]{0.01, -0.01}, 252) > 0.0);
        }
    }
}
