package com.macroallocator.common.economic;

import com.macroallocator.common.exception.InputException;
import com.macroallocator.common.model.EconomicSnapshot;
import com.macroallocator.common.model.Regime;

import java.util.List;
import java.util.function.Predicate;

/**
 * Pure stateless mapping from macro indicators to an economic regime label.
 *
 * <p>Indicator bands:
 * <pre>
 *   CPI year-over-year   High &gt; 3%      Low &lt; 1%
 *   Fed funds rate       Tight &gt; 4%     Loose &lt; 2%
 *   GDP growth           Contracting &le; 0%
 * </pre>
 *
 * <p>Rules (evaluated in priority order):
 * <ol>
 *   <li>High CPI AND Tight rate  → "Stagflation Risk" ({@link Regime#DEFENSIVE})</li>
 *   <li>Contracting GDP          → "Recession Risk"   ({@link Regime#DEFENSIVE})</li>
 *   <li>Low CPI AND Loose rate   → "Growth Favorable" ({@link Regime#AGGRESSIVE})</li>
 *   <li>otherwise                → "Balanced"         ({@link Regime#NEUTRAL})</li>
 * </ol>
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class EconomicContextResolver {

    private static final String COMPONENT = "EconomicContextResolver";

    public static final double CPI_HIGH   = 3.0;
    public static final double CPI_LOW    = 1.0;
    public static final double RATE_TIGHT = 4.0;
    public static final double RATE_LOOSE = 2.0;
    public static final double GDP_FLOOR  = 0.0;

    private record Indicators(double cpi, double fedRate, double gdpGrowth) {}

    private record Rule(String label, String description, Regime recommendation,
                        Predicate<Indicators> condition) {}

    private static final List<Rule> RULES = List.of(
        new Rule("Stagflation Risk",
            "High inflation alongside tight monetary policy squeezes real returns; favor defensive assets.",
            Regime.DEFENSIVE,
            i -> i.cpi() > CPI_HIGH && i.fedRate() > RATE_TIGHT),
        new Rule("Recession Risk",
            "Output is contracting; earnings pressure favors capital preservation.",
            Regime.DEFENSIVE,
            i -> i.gdpGrowth() <= GDP_FLOOR),
        new Rule("Growth Favorable",
            "Low inflation and loose policy support risk assets and growth sectors.",
            Regime.AGGRESSIVE,
            i -> i.cpi() < CPI_LOW && i.fedRate() < RATE_LOOSE),
        new Rule("Balanced",
            "No dominant macro pressure; a diversified stance fits current conditions.",
            Regime.NEUTRAL,
            i -> true)
    );

    private EconomicContextResolver() {}

    /**
     * @param cpiYoyChange CPI year-over-year change, percent
     * @param fedRate      effective federal funds rate, percent
     * @param gdpGrowth    real GDP growth, percent
     * @throws InputException when any indicator is NaN or infinite
     */
    public static EconomicSnapshot resolve(double cpiYoyChange, double fedRate, double gdpGrowth) {
        requireFinite("cpi", cpiYoyChange);
        requireFinite("fedRate", fedRate);
        requireFinite("gdpGrowth", gdpGrowth);

        Indicators indicators = new Indicators(cpiYoyChange, fedRate, gdpGrowth);
        Rule rule = RULES.stream()
            .filter(r -> r.condition().test(indicators))
            .findFirst()
            .orElseThrow();
        return new EconomicSnapshot(cpiYoyChange, fedRate, gdpGrowth,
            rule.label(), rule.description(), rule.recommendation(), false);
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InputException(COMPONENT, name + " must be a finite number: " + value);
        }
    }
}
