package com.macroallocator.common.classifier;

import com.macroallocator.common.model.Regime;

import java.util.List;
import java.util.Map;

/** Sectors favored under each regime. Every regime maps to a non-empty list. */
public final class SectorTilt {

    private SectorTilt() {}

    private static final Map<Regime, List<String>> TILT = Map.of(
        Regime.DEFENSIVE,  List.of("Gold", "Utilities", "Bonds", "Consumer Staples", "Healthcare"),
        Regime.AGGRESSIVE, List.of("Technology", "Semiconductors", "Crypto", "Growth"),
        Regime.NEUTRAL,    List.of("Diversified", "Technology", "Financials", "Healthcare")
    );

    public static List<String> sectorsFor(Regime regime) {
        return TILT.get(regime);
    }
}
