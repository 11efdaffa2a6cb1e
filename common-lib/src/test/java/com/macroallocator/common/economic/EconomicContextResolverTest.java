package com.macroallocator.common.economic;

import com.macroallocator.common.exception.InputException;
import com.macroallocator.common.model.EconomicSnapshot;
import com.macroallocator.common.model.Regime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EconomicContextResolverTest {

    @Test
    @DisplayName("high CPI and tight policy → Stagflation Risk")
    void stagflation() {
        EconomicSnapshot s = EconomicContextResolver.resolve(3.2, 5.25, 2.8);
        assertEquals("Stagflation Risk", s.label());
        assertEquals(Regime.DEFENSIVE, s.recommendation());
        assertFalse(s.fallback());
    }

    @Test
    @DisplayName("stagflation outranks contraction")
    void stagflationFirst() {
        assertEquals("Stagflation Risk", EconomicContextResolver.resolve(6.0, 5.0, -1.0).label());
    }

    @Test
    @DisplayName("zero GDP growth counts as contracting")
    void recession() {
        EconomicSnapshot s = EconomicContextResolver.resolve(2.0, 3.0, 0.0);
        assertEquals("Recession Risk", s.label());
        assertEquals(Regime.DEFENSIVE, s.recommendation());
    }

    @Test
    @DisplayName("low CPI and loose policy → Growth Favorable")
    void growth() {
        EconomicSnapshot s = EconomicContextResolver.resolve(0.5, 0.25, 2.0);
        assertEquals("Growth Favorable", s.label());
        assertEquals(Regime.AGGRESSIVE, s.recommendation());
    }

    @Test
    @DisplayName("band edges are exclusive → Balanced")
    void balancedAtEdges() {
        EconomicSnapshot s = EconomicContextResolver.resolve(3.0, 4.0, 0.1);
        assertEquals("Balanced", s.label());
        assertEquals(Regime.NEUTRAL, s.recommendation());
        assertEquals("Balanced", EconomicContextResolver.resolve(1.0, 2.0, 1.5).label());
    }

    @Test
    @DisplayName("indicators are carried through unchanged")
    void carriesValues() {
        EconomicSnapshot s = EconomicContextResolver.resolve(2.4, 4.33, 1.6);
        assertEquals(2.4, s.cpiYoyChange());
        assertEquals(4.33, s.fedRate());
        assertEquals(1.6, s.gdpGrowth());
        assertFalse(s.description().isBlank());
    }

    @Test
    @DisplayName("non-finite input → InputException")
    void nonFinite() {
        assertThrows(InputException.class, () -> EconomicContextResolver.resolve(Double.NaN, 1.0, 1.0));
        assertThrows(InputException.class, () -> EconomicContextResolver.resolve(1.0, Double.POSITIVE_INFINITY, 1.0));
        assertThrows(InputException.class, () -> EconomicContextResolver.resolve(1.0, 1.0, Double.NEGATIVE_INFINITY));
    }
}
