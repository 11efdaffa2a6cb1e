package com.macroallocator.common.universe;

import com.macroallocator.common.model.Ticker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticSeriesGeneratorTest {

    private final SyntheticSeriesGenerator generator = new SyntheticSeriesGenerator();

    @Test
    @DisplayName("one year of daily returns per symbol")
    void length() {
        assertEquals(SyntheticSeriesGenerator.TRADING_DAYS, generator.returnsFor("GLD").size());
    }

    @Test
    @DisplayName("same symbol and seed → identical series")
    void deterministic() {
        assertEquals(generator.returnsFor("NVDA"), new SyntheticSeriesGenerator().returnsFor("NVDA"));
    }

    @Test
    @DisplayName("different symbols → different series")
    void perSymbol() {
        assertNotEquals(generator.returnsFor("NVDA"), generator.returnsFor("KO"));
    }

    @Test
    @DisplayName("daily returns stay plausible for a 15–35% annual volatility")
    void plausibleMagnitude() {
        List<Double> returns = generator.returnsFor("SPY");
        for (double r : returns) {
            assertTrue(r > -0.2 && r < 0.2, "implausible daily return " + r);
        }
    }

    @Test
    @DisplayName("synthesize() keeps metadata and flags the ticker synthetic")
    void synthesize() {
        Ticker t = generator.synthesize(new TickerDefinition("KO", "Coca-Cola", "Consumer Staples"));
        assertEquals("KO", t.symbol());
        assertEquals("Consumer Staples", t.sector());
        assertTrue(t.synthetic());
        assertEquals(generator.returnsFor("KO"), t.returns());
    }

    @Test
    @DisplayName("non-positive length is rejected")
    void invalidLength() {
        assertThrows(IllegalArgumentException.class, () -> new SyntheticSeriesGenerator(1L, 0));
    }
}
